package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.SkillSource;
import hunter.loadout.core.domain.model.SlotPool;
import hunter.loadout.core.domain.model.Weapon;
import hunter.loadout.core.domain.request.OptimizationRequest;
import hunter.loadout.core.domain.request.SkillRequest;
import hunter.loadout.error.exception.CatalogInconsistencyException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * 카탈로그와 요청으로부터 목적 함수를 붙이기 직전의 제약 모델을 구성합니다.
 *
 * <h3>구성 순서</h3>
 *
 * <ol>
 *   <li>요청 검증 및 카탈로그 모순 검사 (솔버 호출 전)
 *   <li>아이템별 선택 BoolVar, 부위별 exactly-one, 호석 at-most-one, 필터 무기 exactly-one
 *   <li>장식주 배치 ({@link SlotJewelAllocator})
 *   <li>스킬별 raw 포인트 = Σ 포인트 × 선택/사용량 ({@link ConditionalSum})
 *   <li>유효 레벨 ({@link SkillAggregator}) 및 요청 스킬의 레벨 상한
 * </ol>
 */
public class LoadoutModelBuilder {

  private final SkillAggregator skillAggregator;
  private final SlotJewelAllocator slotJewelAllocator;

  public LoadoutModelBuilder(
      SkillAggregator skillAggregator, SlotJewelAllocator slotJewelAllocator) {
    this.skillAggregator = skillAggregator;
    this.slotJewelAllocator = slotJewelAllocator;
  }

  /**
   * @throws hunter.loadout.error.exception.InvalidOptimizationRequestException 잘못된 요청
   * @throws CatalogInconsistencyException 후보가 없는 부위 또는 일치하는 무기가 없는 필터
   */
  LoadoutModel build(Catalog catalog, OptimizationRequest request, String modelName) {
    RequestValidator.validate(catalog, request);
    List<Weapon> weapons = filterWeapons(catalog, request);
    for (BodySlot bodySlot : BodySlot.values()) {
      if (catalog.piecesFor(bodySlot).isEmpty()) {
        throw new CatalogInconsistencyException("no candidate piece for body slot " + bodySlot);
      }
    }

    Model model = new Model(modelName);
    List<SelectionGroup> groups = new ArrayList<>();

    Map<EquipmentPiece, BoolVar> pieces = new LinkedHashMap<>();
    for (BodySlot bodySlot : BodySlot.values()) {
      Map<EquipmentPiece, BoolVar> slotPieces =
          selectExactlyOne(model, catalog.piecesFor(bodySlot));
      pieces.putAll(slotPieces);
      groups.add(new SelectionGroup(SlotPool.ARMOR, slotPieces));
    }

    Map<Charm, BoolVar> charms = selectionVars(model, catalog.charms());
    if (!charms.isEmpty()) {
      model.sum(charms.values().toArray(new BoolVar[0]), "<=", 1).post();
    }

    Map<Weapon, BoolVar> weaponVars = selectExactlyOne(model, weapons);
    groups.add(new SelectionGroup(SlotPool.WEAPON, weaponVars));

    JewelAllocation allocation = slotJewelAllocator.allocate(model, groups, catalog.jewels());

    Map<String, IntVar> effective = new LinkedHashMap<>();
    for (Skill skill : catalog.skills()) {
      ConditionalSum raw = new ConditionalSum();
      addSelected(raw, skill.id(), pieces);
      addSelected(raw, skill.id(), charms);
      addSelected(raw, skill.id(), weaponVars);
      for (Map.Entry<Jewel, IntVar> usage : allocation.usage().entrySet()) {
        raw.add(usage.getKey().pointsFor(skill.id()), usage.getValue());
      }
      IntVar rawVar = raw.post(model, "raw_" + skill.id());
      effective.put(skill.id(), skillAggregator.effectiveLevel(model, skill, rawVar));
    }

    Map<String, IntVar> capped = new LinkedHashMap<>();
    for (SkillRequest skillRequest : request.skills()) {
      IntVar level = effective.get(skillRequest.skillId());
      if (skillRequest.hasLevelCap()) {
        level =
            skillAggregator.capLevel(model, skillRequest.skillId(), level, skillRequest.levelCap());
      }
      capped.put(skillRequest.skillId(), level);
    }

    return new LoadoutModel(
        model, catalog, request, pieces, charms, weaponVars, effective, capped, allocation);
  }

  private static List<Weapon> filterWeapons(Catalog catalog, OptimizationRequest request) {
    List<Weapon> matching =
        catalog.weapons().stream().filter(request.weaponFilter()::matches).toList();
    if (matching.isEmpty()) {
      throw new CatalogInconsistencyException(
          "weapon filter matches no weapon " + request.weaponFilter());
    }
    return matching;
  }

  private static <T extends SkillSource> Map<T, BoolVar> selectionVars(
      Model model, Collection<T> items) {
    Map<T, BoolVar> vars = new LinkedHashMap<>();
    for (T item : items) {
      vars.put(item, model.boolVar("sel_" + item.id()));
    }
    return vars;
  }

  private static <T extends SkillSource> Map<T, BoolVar> selectExactlyOne(
      Model model, Collection<T> items) {
    Map<T, BoolVar> vars = selectionVars(model, items);
    model.sum(vars.values().toArray(new BoolVar[0]), "=", 1).post();
    return vars;
  }

  private static void addSelected(
      ConditionalSum raw, String skillId, Map<? extends SkillSource, BoolVar> selections) {
    for (Map.Entry<? extends SkillSource, BoolVar> entry : selections.entrySet()) {
      raw.add(entry.getKey().pointsFor(skillId), entry.getValue());
    }
  }
}
