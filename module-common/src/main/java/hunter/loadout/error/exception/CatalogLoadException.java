package hunter.loadout.error.exception;

import hunter.loadout.error.CommonErrorCode;
import hunter.loadout.error.exception.base.ServerBaseException;

/** 카탈로그 스냅샷을 읽을 수 없거나 형식/참조 무결성이 깨진 경우. */
public class CatalogLoadException extends ServerBaseException {

  public CatalogLoadException(String location) {
    super(CommonErrorCode.CATALOG_LOAD_FAILED, location);
  }

  // cause를 포함하여 예외 체이닝 지원
  public CatalogLoadException(String location, Throwable cause) {
    super(CommonErrorCode.CATALOG_LOAD_FAILED, cause, location);
  }
}
