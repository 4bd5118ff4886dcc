package hunter.loadout.core.domain.model;

/** Jewel-slot pool: armor pieces feed ARMOR, the weapon feeds WEAPON. */
public enum SlotPool {
  ARMOR,
  WEAPON
}
