package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.model.Catalog;
import hunter.loadout.core.domain.request.OptimizationRequest;
import hunter.loadout.core.domain.request.SkillRequest;
import hunter.loadout.error.exception.InvalidOptimizationRequestException;
import java.util.HashSet;
import java.util.Set;

/** 카탈로그 기준 요청 입력 검증. 도달 불가능한 스킬 레벨은 오류가 아닙니다. */
final class RequestValidator {

  /** 요청 가중치 상한. 목적 함수 항의 범위를 솔버 정수 도메인 안에 유지합니다. */
  static final int MAX_WEIGHT = 10_000;

  private RequestValidator() {}

  static void validate(Catalog catalog, OptimizationRequest request) {
    Set<String> seen = new HashSet<>();
    for (SkillRequest skill : request.skills()) {
      if (skill == null || skill.skillId() == null || skill.skillId().isBlank()) {
        throw new InvalidOptimizationRequestException("skillId is required");
      }
      String id = skill.skillId();
      if (catalog.findSkill(id).isEmpty()) {
        throw new InvalidOptimizationRequestException("unknown skill '" + id + "'");
      }
      if (!seen.add(id)) {
        throw new InvalidOptimizationRequestException("skill '" + id + "' requested twice");
      }
      if (skill.weight() < 0 || skill.weight() > MAX_WEIGHT) {
        throw new InvalidOptimizationRequestException(
            "weight of '" + id + "' must be within 0.." + MAX_WEIGHT + ", got " + skill.weight());
      }
      if (skill.hasLevelCap() && skill.levelCap() < 0) {
        throw new InvalidOptimizationRequestException(
            "levelCap of '" + id + "' must be non-negative, got " + skill.levelCap());
      }
    }
    if (request.timeLimit() != null
        && (request.timeLimit().isNegative() || request.timeLimit().isZero())) {
      throw new InvalidOptimizationRequestException(
          "timeLimit must be positive, got " + request.timeLimit());
    }
  }
}
