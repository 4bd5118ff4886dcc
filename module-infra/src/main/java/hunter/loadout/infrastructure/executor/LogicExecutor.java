package hunter.loadout.infrastructure.executor;

import hunter.loadout.infrastructure.executor.function.ThrowingSupplier;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 넘기세요. 실행기는 시작/성공/느린 작업/실패 로그를 남기고,
 * 실패 시 예외를 도메인 예외로 변환하여 다시 던집니다.
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * Loadout loadout = executor.execute(
 *     () -> optimizer.optimize(catalog, request, options),
 *     TaskContext.of("Loadout", "optimize", "skills=3"));
 * }</pre>
 *
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 기본 변환기로 예외를 변환하여 전파
   *
   * @param <T> 작업 결과 타입
   * @param task 실행할 작업
   * @param context 작업 컨텍스트 (로깅용)
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 지정한 변환기로 예외를 도메인 예외로 변환하여 전파
   *
   * <pre>{@code
   * Catalog catalog = executor.executeWithTranslation(
   *     this::readCatalog,
   *     ExceptionTranslator.forCatalog(location),
   *     TaskContext.of("Catalog", "load", location));
   * }</pre>
   *
   * @param <T> 작업 결과 타입
   * @param task 실행할 작업
   * @param translator 예외 변환기
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
