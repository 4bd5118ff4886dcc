package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;
import java.time.Duration;

/** 제한 시간 안에 해를 하나도 찾지 못한 경우. 해를 찾은 뒤의 시간 초과는 FEASIBLE 결과로 반환됩니다. */
public class SolverTimeoutException extends ServerBaseException {

  public SolverTimeoutException(Duration timeLimit) {
    super(CommonErrorCode.SOLVER_TIMEOUT, timeLimit);
  }
}
