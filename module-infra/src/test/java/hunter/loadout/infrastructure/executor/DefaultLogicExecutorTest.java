package hunter.loadout.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import hunter.loadout.error.exception.CatalogLoadException;
import hunter.loadout.error.exception.InternalSystemException;
import hunter.loadout.error.exception.InvalidOptimizationRequestException;
import hunter.loadout.infrastructure.executor.policy.LoggingPolicy;
import hunter.loadout.infrastructure.executor.strategy.ExceptionTranslator;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultLogicExecutorTest {

  private static final TaskContext CONTEXT = TaskContext.of("Test", "run", "case");

  private final LogicExecutor executor =
      new DefaultLogicExecutor(
          ExceptionTranslator.defaultTranslator(), new LoggingPolicy(Duration.ofMillis(500)));

  @Test
  void returnsTaskResult() {
    assertThat(executor.execute(() -> 42, CONTEXT)).isEqualTo(42);
  }

  @Test
  @DisplayName("도메인 예외는 변환 없이 그대로 전파된다")
  void domainExceptionPassesThrough() {
    InvalidOptimizationRequestException original = new InvalidOptimizationRequestException("x");

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw original;
                    },
                    CONTEXT))
        .isSameAs(original);
  }

  @Test
  @DisplayName("기타 예외는 InternalSystemException으로 변환된다")
  void checkedExceptionIsTranslated() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new IOException("disk");
                    },
                    CONTEXT))
        .isInstanceOf(InternalSystemException.class)
        .hasCauseInstanceOf(IOException.class)
        .satisfies(
            e ->
                assertThat(((InternalSystemException) e).getTaskName())
                    .isEqualTo("Test:run:case"));
  }

  @Test
  @DisplayName("카탈로그 변환기도 도메인 예외는 그대로 통과시킨다")
  void catalogTranslatorKeepsDomainException() {
    InvalidOptimizationRequestException original = new InvalidOptimizationRequestException("y");

    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw original;
                    },
                    ExceptionTranslator.forCatalog("classpath:catalog.json"),
                    CONTEXT))
        .isSameAs(original);
  }

  @Test
  @DisplayName("래핑된 예외는 벗겨내지 않고 원인 그대로 변환한다")
  void wrappedExceptionIsTranslatedAsIs() {
    IllegalStateException wrapper =
        new IllegalStateException(new InvalidOptimizationRequestException("z"));

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw wrapper;
                    },
                    CONTEXT))
        .isInstanceOf(InternalSystemException.class)
        .hasCause(wrapper);
  }

  @Test
  void errorIsRethrownUntranslated() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new StackOverflowError("deep");
                    },
                    CONTEXT))
        .isInstanceOf(StackOverflowError.class);
  }

  @Test
  @DisplayName("커스텀 변환기를 사용한다")
  void customTranslator() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new IOException("missing");
                    },
                    ExceptionTranslator.forCatalog("classpath:catalog.json"),
                    CONTEXT))
        .isInstanceOf(CatalogLoadException.class)
        .hasMessageContaining("classpath:catalog.json");
  }

  @Test
  void taskNameFormat() {
    assertThat(TaskContext.of("Catalog", "load").toTaskName()).isEqualTo("Catalog:load");
    assertThat(CONTEXT.toTaskName()).isEqualTo("Test:run:case");
  }
}
