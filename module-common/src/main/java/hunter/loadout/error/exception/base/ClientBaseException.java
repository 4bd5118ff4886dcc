package hunter.loadout.error.exception.base;

import hunter.loadout.error.ErrorCode;

/**
 * ClientBaseException: 요청 자체가 잘못되었거나 카탈로그로 만족할 수 없을 때 발생하는 4xx 계열의 예외입니다. 사용자에게 구체적인 실패 원인을
 * 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "알 수 없는 스킬입니다 (id: %s)"와 같은 동적 메시지 구성
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
