package hunter.loadout.core.domain.model;

import java.util.List;

/** Jewel-slot size tier. A jewel of size s fits any slot of tier ≥ s. */
public final class SlotTier {

  public static final int MIN = 1;
  public static final int MAX = 3;

  /** Tiers from the largest to the smallest, the order slots are filled and reported in. */
  public static final List<Integer> DESCENDING = List.of(3, 2, 1);

  private SlotTier() {}

  public static boolean isValid(int size) {
    return size >= MIN && size <= MAX;
  }

  public static int requireValid(int size, String owner) {
    if (!isValid(size)) {
      throw new IllegalArgumentException(
          "slot size must be 1, 2, or 3, got: " + size + " (" + owner + ")");
    }
    return size;
  }
}
