package hunter.loadout.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  CATALOG_INCONSISTENT(
      "C002", "요청을 만족하는 후보 장비가 카탈로그에 없습니다: %s", HttpStatus.UNPROCESSABLE_ENTITY),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  LOADOUT_INFEASIBLE("S002", "제약 모델에 해가 존재하지 않습니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  SOLVER_TIMEOUT(
      "S003", "제한 시간 내에 해를 찾지 못했습니다 (limit: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  SOLVE_CANCELLED("S004", "최적화 작업이 취소되었습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  SOLVER_INTERNAL_ERROR("S005", "솔버 내부 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CATALOG_LOAD_FAILED("S006", "카탈로그 로딩 실패 (대상: %s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
