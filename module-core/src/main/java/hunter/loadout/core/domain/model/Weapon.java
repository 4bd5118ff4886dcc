package hunter.loadout.core.domain.model;

import java.util.List;

/**
 * Weapon.
 *
 * @param id unique item identifier
 * @param name display name
 * @param weaponClass weapon class (e.g. "great-sword")
 * @param skills skill grants
 * @param slots jewel-slot sizes (WEAPON pool)
 */
public record Weapon(
    String id, String name, String weaponClass, List<SkillGrant> skills, List<Integer> slots)
    implements SlottedItem {

  public Weapon {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("weapon id cannot be null or blank");
    }
    if (weaponClass == null || weaponClass.isBlank()) {
      throw new IllegalArgumentException("weaponClass cannot be null or blank (weapon " + id + ")");
    }
    name = (name == null || name.isBlank()) ? id : name;
    skills = SlottedItem.copyGrants(skills);
    slots = SlottedItem.copySlots(slots, "weapon " + id);
  }

  @Override
  public SlotPool pool() {
    return SlotPool.WEAPON;
  }
}
