package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.SlotPool;
import hunter.loadout.core.domain.model.SlottedItem;
import java.util.Map;
import org.chocosolver.solver.variables.BoolVar;

/**
 * Slotted items of which exactly one is selected (one body slot, or the filtered weapons).
 *
 * @param pool slot pool the members feed
 * @param members selection variable per item, in catalog order
 */
record SelectionGroup(SlotPool pool, Map<? extends SlottedItem, BoolVar> members) {

  /** Most slots of {@code tier} any single member can offer. */
  int maxSlots(int tier) {
    int max = 0;
    for (SlottedItem item : members.keySet()) {
      max = Math.max(max, item.slotCount(tier));
    }
    return max;
  }
}
