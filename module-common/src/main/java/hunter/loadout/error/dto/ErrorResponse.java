package hunter.loadout.error.dto;

import hunter.loadout.error.ErrorCode;
import hunter.loadout.error.exception.base.BaseException;
import java.time.LocalDateTime;
import lombok.Builder;

/**
 * 실패 응답 본문
 *
 * @param status HTTP 상태 코드
 * @param code 에러 코드 (예: C001, S003)
 * @param message 클라이언트에 노출할 메시지
 * @param timestamp 응답 생성 시각 (미지정 시 현재 시각)
 */
@Builder
public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  public ErrorResponse {
    timestamp = timestamp == null ? LocalDateTime.now() : timestamp;
  }

  /** 예외가 포맷한 메시지(예: 어떤 스킬 ID가 잘못되었는지)를 그대로 전달합니다. */
  public static ErrorResponse from(BaseException e) {
    return of(e.getErrorCode(), e.getMessage());
  }

  /** ErrorCode 기본 메시지만 노출합니다. 상세 원인은 숨깁니다. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return of(errorCode, errorCode.getMessage());
  }

  /** 프레임워크 단계 오류처럼 BaseException 없이 메시지 템플릿에 상세를 채울 때 사용합니다. */
  public static ErrorResponse withDetail(ErrorCode errorCode, Object detail) {
    return of(errorCode, String.format(errorCode.getMessage(), detail));
  }

  private static ErrorResponse of(ErrorCode errorCode, String message) {
    return ErrorResponse.builder()
        .status(errorCode.getStatusCode())
        .code(errorCode.getCode())
        .message(message)
        .build();
  }
}
