package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;

/**
 * 탐색이 완료되었지만 해가 없는 경우.
 *
 * <p>유효한 카탈로그에서는 항상 해가 존재하므로, 이 예외는 모델 구성 결함을 의미합니다.
 */
public class LoadoutInfeasibleException extends ServerBaseException {

  public LoadoutInfeasibleException(String modelName) {
    super(CommonErrorCode.LOADOUT_INFEASIBLE, modelName);
  }
}
