package hunter.loadout.controller.dto;

import hunter.loadout.core.domain.request.OptimizationRequest;
import hunter.loadout.core.domain.request.SkillRequest;
import hunter.loadout.core.domain.request.WeaponFilter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;

/**
 * 장비 조합 최적화 요청 DTO
 *
 * <pre>{@code
 * {
 *   "skills": [{"skillId": "attack", "weight": 3, "levelCap": 3}],
 *   "weapon": {"weaponClass": "great-sword"},
 *   "timeLimitMs": 5000
 * }
 * }</pre>
 *
 * @param skills 요청 스킬 (weight 생략 = 0)
 * @param weapon 무기 필터 (생략 = 모든 무기)
 * @param timeLimitMs 제한 시간 (생략 = 설정 기본값)
 */
public record OptimizeLoadoutRequest(
    List<@Valid SkillEntry> skills, WeaponEntry weapon, @Positive Long timeLimitMs) {

  public record SkillEntry(
      @NotBlank(message = "skillId는 필수입니다.") String skillId,
      @Min(value = 0, message = "weight는 0 이상이어야 합니다.") Integer weight,
      @Min(value = 0, message = "levelCap은 0 이상이어야 합니다.") Integer levelCap) {

    SkillRequest toDomain() {
      return new SkillRequest(skillId, weight == null ? 0 : weight, levelCap);
    }
  }

  public record WeaponEntry(String weaponId, String weaponClass) {}

  public OptimizationRequest toDomain() {
    List<SkillRequest> requests =
        skills == null ? List.of() : skills.stream().map(SkillEntry::toDomain).toList();
    WeaponFilter filter =
        weapon == null
            ? WeaponFilter.any()
            : new WeaponFilter(weapon.weaponId(), weapon.weaponClass());
    Duration timeLimit = timeLimitMs == null ? null : Duration.ofMillis(timeLimitMs);
    return new OptimizationRequest(requests, filter, timeLimit);
  }
}
