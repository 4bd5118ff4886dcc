package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;

/** 도메인 예외로 분류되지 않은 예외를 감싸는 기본 서버 예외 (ExceptionTranslator 기본 변환 대상). */
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }

  public String getTaskName() {
    return taskName;
  }
}
