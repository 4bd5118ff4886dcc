package hunter.loadout.error.exception.base;

import hunter.loadout.error.ErrorCode;

/**
 * ServerBaseException: 솔버 실패, 모델 결함, 데이터 로딩 오류 등 5xx 계열의 예외입니다. 장애 분석을 위한 상세 로그를 남기는 것이 주
 * 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  protected ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
