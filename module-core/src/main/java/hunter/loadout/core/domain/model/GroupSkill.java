package hunter.loadout.core.domain.model;

/**
 * Skill that grants nothing until its raw points reach {@code threshold}, then behaves like a
 * standard skill.
 *
 * @param id unique skill identifier
 * @param name display name
 * @param maxLevel maximum effective level (≥ 1)
 * @param threshold minimum raw points for activation (≥ 1)
 */
public record GroupSkill(String id, String name, int maxLevel, int threshold) implements Skill {

  public GroupSkill {
    Skill.requireIdentity(id, name, maxLevel);
    if (threshold < 1) {
      throw new IllegalArgumentException(
          "threshold must be positive, got: " + threshold + " (skill " + id + ")");
    }
  }

  @Override
  public SkillKind kind() {
    return SkillKind.GROUP;
  }
}
