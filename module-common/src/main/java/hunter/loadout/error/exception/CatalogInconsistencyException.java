package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ClientBaseException;

/**
 * 카탈로그가 요청에 대해 모순일 때 발생합니다.
 *
 * <ul>
 *   <li>후보 장비가 하나도 없는 부위가 있는 경우
 *   <li>무기 필터에 일치하는 무기가 없는 경우
 * </ul>
 */
public class CatalogInconsistencyException extends ClientBaseException {

  public CatalogInconsistencyException(String detail) {
    super(CommonErrorCode.CATALOG_INCONSISTENT, detail);
  }
}
