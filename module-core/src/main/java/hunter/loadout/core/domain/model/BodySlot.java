package hunter.loadout.core.domain.model;

/** Armor body-slot category. Exactly one piece is equipped per category. */
public enum BodySlot {
  HEAD,
  CHEST,
  ARMS,
  WAIST,
  LEGS
}
