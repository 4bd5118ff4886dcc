package hunter.loadout.global.error;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.dto.ErrorResponse;
import hunter.loadout.error.exception.base.BaseException;
import hunter.loadout.error.exception.base.ClientBaseException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 비즈니스 예외 처리 (동적 메시지 포함)
   *
   * <p>클라이언트 오류(4xx)는 WARN, 서버 오류(5xx)는 스택 트레이스와 함께 ERROR로 기록합니다.
   */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ClientBaseException) {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    } else {
      log.error(
          "Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    }
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(ErrorResponse.from(e));
  }

  /** Bean Validation 실패 → C001 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining(", "));
    return invalidInput(detail);
  }

  /** 본문 파싱 실패 → C001 */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return invalidInput("malformed request body");
  }

  /** 예측하지 못한 시스템 예외: 상세 메시지를 숨기고 공통 코드를 반환 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    CommonErrorCode code = CommonErrorCode.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(code.getStatus()).body(ErrorResponse.from(code));
  }

  private ResponseEntity<ErrorResponse> invalidInput(String detail) {
    CommonErrorCode code = CommonErrorCode.INVALID_INPUT_VALUE;
    log.warn("Invalid Input: {}", detail);
    return ResponseEntity.status(code.getStatus()).body(ErrorResponse.withDetail(code, detail));
  }

  private static String describe(FieldError error) {
    return error.getField() + ": " + error.getDefaultMessage();
  }
}
