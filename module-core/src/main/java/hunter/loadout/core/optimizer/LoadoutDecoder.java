package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.BodySlot;
import hunter.loadout.core.domain.model.Charm;
import hunter.loadout.core.domain.model.EquipmentPiece;
import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.SlotPool;
import hunter.loadout.core.domain.model.SlotTier;
import hunter.loadout.core.domain.model.SlottedItem;
import hunter.loadout.core.domain.model.Weapon;
import hunter.loadout.core.domain.request.SkillRequest;
import hunter.loadout.core.domain.result.Loadout;
import hunter.loadout.core.domain.result.ObjectiveScore;
import hunter.loadout.core.domain.result.SocketedJewel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.chocosolver.solver.Solution;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * 솔버 해를 {@link Loadout}으로 변환합니다.
 *
 * <p>(풀, 티어)별 배치 수를 선택된 아이템의 실제 슬롯에 순서대로 채웁니다. 방어구는 부위 순서(HEAD → LEGS), 각 아이템 안에서는 슬롯
 * 순서를 따르며, 장식주는 카탈로그 순서로 배치됩니다.
 */
final class LoadoutDecoder {

  private LoadoutDecoder() {}

  static Loadout decode(LoadoutModel loadoutModel, ObjectivePlan plan, SolveOutcome outcome) {
    Solution solution = outcome.solution();

    Map<BodySlot, EquipmentPiece> pieces = new EnumMap<>(BodySlot.class);
    for (EquipmentPiece piece : selected(solution, loadoutModel.pieces())) {
      pieces.put(piece.bodySlot(), piece);
    }
    List<Charm> charms = selected(solution, loadoutModel.charms());
    Weapon weapon = selected(solution, loadoutModel.weapons()).get(0);

    List<SlottedItem> owners = new ArrayList<>();
    for (BodySlot bodySlot : BodySlot.values()) {
      owners.add(pieces.get(bodySlot));
    }
    owners.add(weapon);

    // 요청 스킬도 실제 유효 레벨로 보고. 레벨 상한은 1순위 목적 항에만 반영된다
    Map<String, IntVar> effective = loadoutModel.effectiveLevels();
    Map<String, Integer> requested = new LinkedHashMap<>();
    for (SkillRequest skillRequest : loadoutModel.request().skills()) {
      String id = skillRequest.skillId();
      requested.put(id, value(solution, effective.get(id)));
    }

    Map<String, Integer> bonus = new LinkedHashMap<>();
    effective.forEach(
        (id, level) -> {
          int achieved = value(solution, level);
          if (achieved > 0 && !requested.containsKey(id)) {
            bonus.put(id, achieved);
          }
        });

    Map<Integer, Integer> free = new LinkedHashMap<>();
    for (int tier : SlotTier.DESCENDING) {
      int total = 0;
      for (SlotPool pool : SlotPool.values()) {
        total += value(solution, loadoutModel.jewels().free().get(pool).get(tier));
      }
      free.put(tier, total);
    }

    ObjectiveScore score =
        new ObjectiveScore(
            value(solution, plan.primary()),
            value(solution, plan.secondary()),
            value(solution, plan.tertiary()));

    return new Loadout(
        pieces,
        charms.isEmpty() ? null : charms.get(0),
        weapon,
        socket(solution, loadoutModel.jewels(), owners),
        requested,
        bonus,
        free,
        score,
        outcome.status());
  }

  private static List<SocketedJewel> socket(
      Solution solution, JewelAllocation allocation, List<SlottedItem> owners) {
    List<SocketedJewel> socketed = new ArrayList<>();
    for (SlotPool pool : SlotPool.values()) {
      for (int tier : SlotTier.DESCENDING) {
        Deque<SocketedJewel> openSlots = openSlots(owners, pool, tier);
        for (Map.Entry<Jewel, Map<Integer, IntVar>> entry : allocation.placements().entrySet()) {
          Jewel jewel = entry.getKey();
          IntVar placement = entry.getValue().get(tier);
          if (jewel.pool() != pool || placement == null) {
            continue;
          }
          for (int unit = value(solution, placement); unit > 0; unit--) {
            SocketedJewel slot = openSlots.poll();
            if (slot == null) {
              throw new IllegalStateException(
                  "placement exceeds available " + pool + " tier-" + tier + " slots");
            }
            socketed.add(new SocketedJewel(slot.ownerId(), slot.slotIndex(), tier, jewel.id()));
          }
        }
      }
    }
    return socketed;
  }

  /** Empty slots of the selected owners for one pool and tier, jewel id left null. */
  private static Deque<SocketedJewel> openSlots(List<SlottedItem> owners, SlotPool pool, int tier) {
    Deque<SocketedJewel> slots = new ArrayDeque<>();
    for (SlottedItem owner : owners) {
      if (owner.pool() != pool) {
        continue;
      }
      List<Integer> sizes = owner.slots();
      for (int index = 0; index < sizes.size(); index++) {
        if (sizes.get(index) == tier) {
          slots.add(new SocketedJewel(owner.id(), index, tier, null));
        }
      }
    }
    return slots;
  }

  private static <T> List<T> selected(Solution solution, Map<T, BoolVar> selections) {
    List<T> chosen = new ArrayList<>();
    selections.forEach(
        (item, selection) -> {
          if (value(solution, selection) == 1) {
            chosen.add(item);
          }
        });
    return chosen;
  }

  private static int value(Solution solution, IntVar variable) {
    return variable.isInstantiated() ? variable.getValue() : solution.getIntVal(variable);
  }
}
