package hunter.loadout.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import hunter.loadout.error.exception.CatalogLoadException;
import hunter.loadout.error.exception.InternalSystemException;
import hunter.loadout.error.exception.base.BaseException;
import hunter.loadout.infrastructure.executor.TaskContext;
import java.io.IOException;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error는 즉시 rethrow하고 BaseException은 그대로 통과시키는 Decorator. 나머지는 내부 translator에
   * 위임합니다.
   */
  static ExceptionTranslator withErrorGuard(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      if (e instanceof BaseException be) {
        return be;
      }
      return inner.translate(e, context);
    };
  }

  /** 기본 예외 변환기: 도메인 예외가 아니면 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuard(
        (cause, context) -> new InternalSystemException(context.toTaskName(), cause));
  }

  /**
   * 카탈로그 로딩 전용 변환기
   *
   * <p>I/O 실패, JSON 파싱 실패, 엔티티 검증 실패(IllegalArgumentException)를 {@link CatalogLoadException}으로
   * 변환합니다.
   *
   * @param location 카탈로그 위치 (메시지용)
   */
  static ExceptionTranslator forCatalog(String location) {
    return withErrorGuard(
        (cause, context) -> {
          if (cause instanceof JsonProcessingException
              || cause instanceof IOException
              || cause instanceof IllegalArgumentException) {
            return new CatalogLoadException(location, cause);
          }
          return new InternalSystemException(context.toTaskName(), cause);
        });
  }
}
