package hunter.loadout.infrastructure.executor.policy;

import static hunter.loadout.infrastructure.executor.policy.TaskLogTags.TAG_FAILURE;
import static hunter.loadout.infrastructure.executor.policy.TaskLogTags.TAG_SLOW;
import static hunter.loadout.infrastructure.executor.policy.TaskLogTags.TAG_START;
import static hunter.loadout.infrastructure.executor.policy.TaskLogTags.TAG_SUCCESS;

import hunter.loadout.error.exception.base.ClientBaseException;
import hunter.loadout.infrastructure.executor.TaskContext;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * 작업 실행 단계별 로깅 정책 (Stateless)
 *
 * <ul>
 *   <li>before: [Task:START] {taskName} → DEBUG
 *   <li>onSuccess (normal): [Task:SUCCESS] {taskName}, elapsed=... → DEBUG
 *   <li>onSuccess (slow): [Task:SLOW] {taskName}, elapsed=..., threshold=...ms → INFO
 *   <li>onFailure: [Task:FAILURE] {taskName}, elapsed=..., errorType=... → 클라이언트 예외는 WARN, 그 외는
 *       ERROR (stacktrace 포함)
 * </ul>
 */
@Slf4j
public class LoggingPolicy {

  private static final long MAX_SLOW_MS = 600_000L;

  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /**
   * @param slowThreshold slow 판정 임계치. 0 이하: SLOW 비활성
   */
  public LoggingPolicy(Duration slowThreshold) {
    long clamped = Math.max(0L, Math.min(slowThreshold.toMillis(), MAX_SLOW_MS));

    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? Duration.ofMillis(clamped).toNanos() : Long.MAX_VALUE;
  }

  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}", TAG_START, TaskLogSupport.safeTaskName(context));
  }

  public void onSuccess(long elapsedNanos, TaskContext context) {
    String taskName = TaskLogSupport.safeTaskName(context);
    String elapsed = TaskLogSupport.formatDuration(elapsedNanos);

    if (isSlow(elapsedNanos)) {
      log.info("{} {}, elapsed={}, threshold={}ms", TAG_SLOW, taskName, elapsed, slowThresholdMs);
      return;
    }
    log.debug("{} {}, elapsed={}", TAG_SUCCESS, taskName, elapsed);
  }

  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String taskName = TaskLogSupport.safeTaskName(context);
    String elapsed = TaskLogSupport.formatDuration(elapsedNanos);
    String errorType = (error != null) ? error.getClass().getSimpleName() : "UnknownError";

    // 요청 오류는 stacktrace 없이 WARN
    if (error instanceof ClientBaseException) {
      log.warn(
          "{} {}, elapsed={}, errorType={}, message={}",
          TAG_FAILURE,
          taskName,
          elapsed,
          errorType,
          error.getMessage());
      return;
    }
    log.error("{} {}, elapsed={}, errorType={}", TAG_FAILURE, taskName, elapsed, errorType, error);
  }

  boolean isSlow(long elapsedNanos) {
    return slowEnabled && elapsedNanos >= slowThresholdNanos;
  }
}
