package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.SlotPool;
import hunter.loadout.core.domain.model.SlotTier;
import hunter.loadout.core.domain.model.SlottedItem;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.BoolVar;
import org.chocosolver.solver.variables.IntVar;

/**
 * 장식주 배치 및 슬롯 용량 모델링 컴포넌트
 *
 * <h3>모델</h3>
 *
 * <ul>
 *   <li>(풀, 티어 t)마다 available_t = Σ (선택된 아이템의 t 크기 슬롯 수)
 *   <li>(장식주, t ≥ 크기)마다 배치 변수. 장식주 사용량 = Σ 배치
 *   <li>용량: Σ 배치(t) + free_t = available_t, free_t ≥ 0
 * </ul>
 *
 * <p>더 큰 슬롯은 작은 장식주를 받을 수 있지만 그 슬롯의 용량을 소모합니다. 장식주 공급은 무제한이며 용량 외의 상한은 없습니다. 배치를 모두 0으로
 * 두면 항상 만족되므로 이 컴포넌트는 모델을 infeasible로 만들지 않습니다.
 */
public class SlotJewelAllocator {

  JewelAllocation allocate(Model model, List<SelectionGroup> groups, List<Jewel> jewels) {
    Map<SlotPool, Map<Integer, Integer>> maxAvailable = maxAvailable(groups);
    Map<SlotPool, Map<Integer, IntVar>> available = availableSlots(model, groups, maxAvailable);

    Map<Jewel, Map<Integer, IntVar>> placements = new LinkedHashMap<>();
    Map<Jewel, IntVar> usage = new LinkedHashMap<>();
    for (Jewel jewel : jewels) {
      Map<Integer, IntVar> byTier = new LinkedHashMap<>();
      ConditionalSum total = new ConditionalSum();
      for (int tier = jewel.size(); tier <= SlotTier.MAX; tier++) {
        int bound = maxAvailable.get(jewel.pool()).get(tier);
        if (bound == 0) {
          continue;
        }
        IntVar placed = model.intVar("place_" + jewel.id() + "_t" + tier, 0, bound, true);
        byTier.put(tier, placed);
        total.add(1, placed);
      }
      placements.put(jewel, byTier);
      usage.put(jewel, total.post(model, "use_" + jewel.id()));
    }

    Map<SlotPool, Map<Integer, IntVar>> free =
        freeSlots(model, available, maxAvailable, placements);
    return new JewelAllocation(usage, placements, available, free, maxAvailable);
  }

  private static Map<SlotPool, Map<Integer, Integer>> maxAvailable(List<SelectionGroup> groups) {
    Map<SlotPool, Map<Integer, Integer>> bounds = new EnumMap<>(SlotPool.class);
    for (SlotPool pool : SlotPool.values()) {
      Map<Integer, Integer> byTier = new LinkedHashMap<>();
      for (int tier = SlotTier.MIN; tier <= SlotTier.MAX; tier++) {
        byTier.put(tier, 0);
      }
      bounds.put(pool, byTier);
    }
    for (SelectionGroup group : groups) {
      Map<Integer, Integer> byTier = bounds.get(group.pool());
      for (int tier = SlotTier.MIN; tier <= SlotTier.MAX; tier++) {
        byTier.merge(tier, group.maxSlots(tier), Integer::sum);
      }
    }
    return bounds;
  }

  private static Map<SlotPool, Map<Integer, IntVar>> availableSlots(
      Model model, List<SelectionGroup> groups, Map<SlotPool, Map<Integer, Integer>> bounds) {
    Map<SlotPool, Map<Integer, IntVar>> available = new EnumMap<>(SlotPool.class);
    for (SlotPool pool : SlotPool.values()) {
      Map<Integer, IntVar> byTier = new LinkedHashMap<>();
      for (int tier = SlotTier.MIN; tier <= SlotTier.MAX; tier++) {
        ConditionalSum slots = new ConditionalSum();
        for (SelectionGroup group : groups) {
          if (group.pool() != pool) {
            continue;
          }
          for (Map.Entry<? extends SlottedItem, BoolVar> member : group.members().entrySet()) {
            slots.add(member.getKey().slotCount(tier), member.getValue());
          }
        }
        String name = "avail_" + pool.name().toLowerCase(Locale.ROOT) + "_t" + tier;
        byTier.put(tier, slots.post(model, name, bounds.get(pool).get(tier)));
      }
      available.put(pool, byTier);
    }
    return available;
  }

  private static Map<SlotPool, Map<Integer, IntVar>> freeSlots(
      Model model,
      Map<SlotPool, Map<Integer, IntVar>> available,
      Map<SlotPool, Map<Integer, Integer>> bounds,
      Map<Jewel, Map<Integer, IntVar>> placements) {
    Map<SlotPool, Map<Integer, IntVar>> free = new EnumMap<>(SlotPool.class);
    for (SlotPool pool : SlotPool.values()) {
      Map<Integer, IntVar> byTier = new LinkedHashMap<>();
      for (int tier = SlotTier.MIN; tier <= SlotTier.MAX; tier++) {
        ConditionalSum placed = new ConditionalSum();
        for (Map.Entry<Jewel, Map<Integer, IntVar>> entry : placements.entrySet()) {
          IntVar placement = entry.getValue().get(tier);
          if (entry.getKey().pool() == pool && placement != null) {
            placed.add(1, placement);
          }
        }
        String suffix = pool.name().toLowerCase(Locale.ROOT) + "_t" + tier;
        int bound = bounds.get(pool).get(tier);
        IntVar placedVar = placed.post(model, "placed_" + suffix);
        IntVar freeVar = model.intVar("free_" + suffix, 0, bound, true);
        // placed + free = available, free ≥ 0 이므로 용량 제약을 겸한다
        model.sum(new IntVar[] {placedVar, freeVar}, "=", available.get(pool).get(tier)).post();
        byTier.put(tier, freeVar);
      }
      free.put(pool, byTier);
    }
    return free;
  }
}
