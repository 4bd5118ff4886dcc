package hunter.loadout.infrastructure.executor;

import hunter.loadout.infrastructure.executor.function.ThrowingSupplier;
import hunter.loadout.infrastructure.executor.policy.LoggingPolicy;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.Objects;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>로깅</b>: {@link LoggingPolicy}로 START/SUCCESS/SLOW/FAILURE 기록
 *   <li><b>번역 실패 격리</b>: translator가 던진 RuntimeException은 그 자체를 primary로 전파
 * </ul>
 */
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;
  private final LoggingPolicy loggingPolicy;

  public DefaultLogicExecutor(ExceptionTranslator translator, LoggingPolicy loggingPolicy) {
    this.translator = Objects.requireNonNull(translator, "translator");
    this.loggingPolicy = Objects.requireNonNull(loggingPolicy, "loggingPolicy");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    loggingPolicy.before(context);
    long start = System.nanoTime();
    try {
      T result = task.get();
      loggingPolicy.onSuccess(System.nanoTime() - start, context);
      return result;
    } catch (Error e) {
      loggingPolicy.onFailure(e, System.nanoTime() - start, context);
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(customTranslator, t, context);
      loggingPolicy.onFailure(primary, System.nanoTime() - start, context);
      throw primary;
    }
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error err) {
      throw err;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }
}
