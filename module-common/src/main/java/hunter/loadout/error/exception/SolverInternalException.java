package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;

public class SolverInternalException extends ServerBaseException {

  public SolverInternalException(String modelName, Throwable cause) {
    super(CommonErrorCode.SOLVER_INTERNAL_ERROR, cause, modelName);
  }
}
