package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ClientBaseException;

/** 알 수 없는 스킬, 음수 가중치/레벨 상한, 허용 범위를 벗어난 제한 시간 등 잘못된 최적화 요청. */
public class InvalidOptimizationRequestException extends ClientBaseException {

  public InvalidOptimizationRequestException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
