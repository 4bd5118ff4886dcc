package hunter.loadout.core.domain.model;

/** Activation rule applied to a skill's raw points. */
public enum SkillKind {
  /** effective = min(raw, max) */
  STANDARD,
  /** inactive below a single threshold, standard above it */
  GROUP,
  /** stepped levels unlocked at increasing point thresholds */
  SERIES
}
