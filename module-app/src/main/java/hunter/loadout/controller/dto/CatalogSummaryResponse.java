package hunter.loadout.controller.dto;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.model.Skill;
import hunter.loadout.core.domain.model.Weapon;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 카탈로그 요약 응답
 *
 * @param skills 스킬 (id, 이름, 종류, 최대 레벨)
 * @param piecesPerBodySlot 부위별 방어구 수
 * @param charms 호석 수
 * @param weaponClasses 무기 종류 (중복 제거, 카탈로그 순서)
 * @param jewels 장식주 수
 */
public record CatalogSummaryResponse(
    List<SkillSummary> skills,
    Map<BodySlot, Integer> piecesPerBodySlot,
    int charms,
    List<String> weaponClasses,
    int jewels) {

  public record SkillSummary(String id, String name, String kind, int maxLevel) {

    static SkillSummary from(Skill skill) {
      return new SkillSummary(skill.id(), skill.name(), skill.kind().name(), skill.maxLevel());
    }
  }

  public static CatalogSummaryResponse from(Catalog catalog) {
    Map<BodySlot, Integer> perSlot = new LinkedHashMap<>();
    for (BodySlot slot : BodySlot.values()) {
      perSlot.put(slot, catalog.piecesFor(slot).size());
    }
    return new CatalogSummaryResponse(
        catalog.skills().stream().map(SkillSummary::from).toList(),
        perSlot,
        catalog.charms().size(),
        catalog.weapons().stream().map(Weapon::weaponClass).distinct().toList(),
        catalog.jewels().size());
  }
}
