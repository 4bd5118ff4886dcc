package hunter.loadout.core.domain.model;

/**
 * Skill whose effective level is its raw points capped at the maximum level.
 *
 * @param id unique skill identifier
 * @param name display name
 * @param maxLevel maximum effective level (≥ 1)
 */
public record StandardSkill(String id, String name, int maxLevel) implements Skill {

  public StandardSkill {
    Skill.requireIdentity(id, name, maxLevel);
  }

  @Override
  public SkillKind kind() {
    return SkillKind.STANDARD;
  }
}
