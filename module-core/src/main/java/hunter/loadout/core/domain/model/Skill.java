package hunter.loadout.core.domain.model;

/**
 * Skill domain model.
 *
 * <p>Kind-specific data (group threshold, series steps) lives only on the matching variant.
 *
 * @see StandardSkill
 * @see GroupSkill
 * @see SeriesSkill
 */
public sealed interface Skill permits StandardSkill, GroupSkill, SeriesSkill {

  String id();

  String name();

  int maxLevel();

  SkillKind kind();

  /** Validation shared by all variants. */
  static void requireIdentity(String id, String name, int maxLevel) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("skill id cannot be null or blank");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("skill name cannot be null or blank: " + id);
    }
    if (maxLevel < 1) {
      throw new IllegalArgumentException(
          "maxLevel must be positive, got: " + maxLevel + " (skill " + id + ")");
    }
  }
}
