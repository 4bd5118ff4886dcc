package hunter.loadout.core.domain.request;

/**
 * 요청 스킬 한 건.
 *
 * @param skillId 스킬 식별자
 * @param weight 우선순위 가중치 (0 = 선호 없음, 보너스 스킬 집계에는 포함)
 * @param levelCap 레벨 상한 (null = 상한 없음)
 */
public record SkillRequest(String skillId, int weight, Integer levelCap) {

  public static SkillRequest of(String skillId, int weight) {
    return new SkillRequest(skillId, weight, null);
  }

  public static SkillRequest capped(String skillId, int weight, int levelCap) {
    return new SkillRequest(skillId, weight, levelCap);
  }

  public boolean hasLevelCap() {
    return levelCap != null;
  }
}
