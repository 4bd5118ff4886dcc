package hunter.loadout.core.domain.model;

/** Which slot pool a jewel may be socketed into. */
public enum JewelKind {
  ARMOR(SlotPool.ARMOR),
  WEAPON(SlotPool.WEAPON);

  private final SlotPool pool;

  JewelKind(SlotPool pool) {
    this.pool = pool;
  }

  public SlotPool pool() {
    return pool;
  }
}
