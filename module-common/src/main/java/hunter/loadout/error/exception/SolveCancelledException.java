package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;

public class SolveCancelledException extends ServerBaseException {

  public SolveCancelledException(String modelName) {
    super(CommonErrorCode.SOLVE_CANCELLED, modelName);
  }
}
