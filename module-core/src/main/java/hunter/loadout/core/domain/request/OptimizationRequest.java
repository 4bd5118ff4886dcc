package hunter.loadout.core.domain.request;

import java.time.Duration;
import java.util.List;

/**
 * 최적화 요청.
 *
 * @param skills 요청 스킬 목록 (요청 순서가 결과 순서가 됩니다)
 * @param weaponFilter 무기 후보 필터
 * @param timeLimit 요청별 제한 시간 (null = 설정 기본값)
 */
public record OptimizationRequest(
    List<SkillRequest> skills, WeaponFilter weaponFilter, Duration timeLimit) {

  public OptimizationRequest {
    skills = skills == null ? List.of() : List.copyOf(skills);
    weaponFilter = weaponFilter == null ? WeaponFilter.any() : weaponFilter;
  }

  public static OptimizationRequest of(List<SkillRequest> skills, WeaponFilter weaponFilter) {
    return new OptimizationRequest(skills, weaponFilter, null);
  }
}
