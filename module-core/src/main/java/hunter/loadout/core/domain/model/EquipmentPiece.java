package hunter.loadout.core.domain.model;

import java.util.List;

/**
 * Armor piece.
 *
 * @param id unique item identifier
 * @param name display name
 * @param bodySlot body-slot category
 * @param skills skill grants (possibly empty)
 * @param slots jewel-slot sizes (ARMOR pool)
 */
public record EquipmentPiece(
    String id, String name, BodySlot bodySlot, List<SkillGrant> skills, List<Integer> slots)
    implements SlottedItem {

  public EquipmentPiece {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("piece id cannot be null or blank");
    }
    if (bodySlot == null) {
      throw new IllegalArgumentException("bodySlot cannot be null (piece " + id + ")");
    }
    name = (name == null || name.isBlank()) ? id : name;
    skills = SlottedItem.copyGrants(skills);
    slots = SlottedItem.copySlots(slots, "piece " + id);
  }

  @Override
  public SlotPool pool() {
    return SlotPool.ARMOR;
  }
}
