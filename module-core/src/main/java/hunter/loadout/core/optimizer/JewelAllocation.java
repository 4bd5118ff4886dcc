package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.Jewel;
import hunter.loadout.core.domain.model.SlotPool;
import java.util.Map;
import org.chocosolver.solver.variables.IntVar;

/**
 * Variables produced by {@link SlotJewelAllocator}.
 *
 * @param usage total units placed per jewel
 * @param placements units placed per jewel and slot tier (only tiers that can hold it)
 * @param available available slots per pool and tier
 * @param free free slots per pool and tier
 * @param maxAvailable most slots each pool can ever offer per tier
 */
record JewelAllocation(
    Map<Jewel, IntVar> usage,
    Map<Jewel, Map<Integer, IntVar>> placements,
    Map<SlotPool, Map<Integer, IntVar>> available,
    Map<SlotPool, Map<Integer, IntVar>> free,
    Map<SlotPool, Map<Integer, Integer>> maxAvailable) {

  /** Most free slots of {@code tier} over all pools. */
  int maxFree(int tier) {
    int total = 0;
    for (Map<Integer, Integer> byTier : maxAvailable.values()) {
      total += byTier.getOrDefault(tier, 0);
    }
    return total;
  }
}
