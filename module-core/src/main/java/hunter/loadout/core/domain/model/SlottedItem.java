package hunter.loadout.core.domain.model;

import java.util.List;

/** An equippable item carrying jewel slots. */
public interface SlottedItem extends SkillSource {

  /** Ordered slot sizes, each 1..3. */
  List<Integer> slots();

  SlotPool pool();

  default int slotCount(int tier) {
    int count = 0;
    for (int size : slots()) {
      if (size == tier) {
        count++;
      }
    }
    return count;
  }

  /** Validates and copies a slot list. */
  static List<Integer> copySlots(List<Integer> slots, String owner) {
    if (slots == null) {
      return List.of();
    }
    for (Integer size : slots) {
      if (size == null) {
        throw new IllegalArgumentException("slot size cannot be null (" + owner + ")");
      }
      SlotTier.requireValid(size, owner);
    }
    return List.copyOf(slots);
  }

  static List<SkillGrant> copyGrants(List<SkillGrant> grants) {
    return grants == null ? List.of() : List.copyOf(grants);
  }
}
