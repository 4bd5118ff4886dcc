package hunter.loadout.core.domain.model;

/**
 * Skill points granted by an item.
 *
 * @param skillId referenced skill identifier
 * @param points raw points (> 0)
 */
public record SkillGrant(String skillId, int points) {

  public SkillGrant {
    if (skillId == null || skillId.isBlank()) {
      throw new IllegalArgumentException("skillId cannot be null or blank");
    }
    if (points <= 0) {
      throw new IllegalArgumentException(
          "points must be positive, got: " + points + " (skill " + skillId + ")");
    }
  }

  public static SkillGrant of(String skillId, int points) {
    return new SkillGrant(skillId, points);
  }
}
