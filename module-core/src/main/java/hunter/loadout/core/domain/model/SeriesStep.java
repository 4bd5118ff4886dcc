package hunter.loadout.core.domain.model;

/**
 * One step of a series skill: reaching {@code threshold} raw points unlocks {@code level}.
 *
 * @param threshold raw points required (≥ 1)
 * @param level effective level granted (≥ 1)
 */
public record SeriesStep(int threshold, int level) {

  public SeriesStep {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be positive, got: " + threshold);
    }
    if (level < 1) {
      throw new IllegalArgumentException("level must be positive, got: " + level);
    }
  }
}
