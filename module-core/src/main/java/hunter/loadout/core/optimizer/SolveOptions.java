package hunter.loadout.core.optimizer;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * 단일 solve 호출의 실행 옵션.
 *
 * @param timeLimit wall-clock 제한 시간 (모든 목적 단계 합산)
 * @param cancelled 취소 여부를 반환하는 훅. 호출 스레드의 interrupt 상태도 함께 확인합니다.
 */
public record SolveOptions(Duration timeLimit, BooleanSupplier cancelled) {

  private static final BooleanSupplier NEVER = () -> false;

  public SolveOptions {
    Objects.requireNonNull(timeLimit, "timeLimit");
    if (timeLimit.isNegative() || timeLimit.isZero()) {
      throw new IllegalArgumentException("timeLimit must be positive, got: " + timeLimit);
    }
    cancelled = cancelled == null ? NEVER : cancelled;
  }

  public static SolveOptions withTimeLimit(Duration timeLimit) {
    return new SolveOptions(timeLimit, NEVER);
  }

  boolean isCancelled() {
    return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
  }
}
