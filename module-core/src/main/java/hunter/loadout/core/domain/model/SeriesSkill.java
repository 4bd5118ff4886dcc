package hunter.loadout.core.domain.model;

import java.util.List;

/**
 * Skill with stepped levels.
 *
 * <p>The steps partition the raw-point range into half-open intervals {@code [0, t1), [t1, t2),
 * ..., [tn, ∞)}. The first interval grants level 0, interval {@code i} grants {@code steps[i-1]
 * .level}.
 *
 * @param id unique skill identifier
 * @param name display name
 * @param maxLevel maximum effective level (≥ 1)
 * @param steps ordered steps, thresholds strictly increasing, levels non-decreasing and ≤ maxLevel
 */
public record SeriesSkill(String id, String name, int maxLevel, List<SeriesStep> steps)
    implements Skill {

  public SeriesSkill {
    Skill.requireIdentity(id, name, maxLevel);
    if (steps == null || steps.isEmpty()) {
      throw new IllegalArgumentException("series skill needs at least one step: " + id);
    }
    steps = List.copyOf(steps);
    int previousThreshold = 0;
    int previousLevel = 0;
    for (SeriesStep step : steps) {
      if (step.threshold() <= previousThreshold) {
        throw new IllegalArgumentException(
            "series thresholds must be strictly increasing (skill " + id + "): " + steps);
      }
      if (step.level() < previousLevel || step.level() > maxLevel) {
        throw new IllegalArgumentException(
            "series levels must be non-decreasing and ≤ maxLevel (skill " + id + "): " + steps);
      }
      previousThreshold = step.threshold();
      previousLevel = step.level();
    }
  }

  @Override
  public SkillKind kind() {
    return SkillKind.SERIES;
  }

  /** Effective level for a concrete raw point total. */
  public int levelAt(int rawPoints) {
    int level = 0;
    for (SeriesStep step : steps) {
      if (rawPoints < step.threshold()) {
        break;
      }
      level = step.level();
    }
    return level;
  }
}
