package hunter.loadout.infrastructure.executor.policy;

import hunter.loadout.infrastructure.executor.TaskContext;
import java.util.Locale;
import java.util.regex.Pattern;

/** 작업 로깅 헬퍼 */
public final class TaskLogSupport {

  private static final String UNKNOWN = "unknown";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TaskLogSupport() {}

  /**
   * TaskContext를 로그용 문자열로 변환합니다. 제어문자/공백은 한 칸 공백으로 정규화합니다.
   *
   * @return Task 이름 (context가 없거나 비어 있으면 "unknown")
   */
  public static String safeTaskName(TaskContext context) {
    if (context == null) return UNKNOWN;

    String normalized = WHITESPACE.matcher(context.toTaskName()).replaceAll(" ").trim();
    return normalized.isEmpty() ? UNKNOWN : normalized;
  }

  static String formatDuration(long elapsedNanos) {
    double millis = elapsedNanos / 1_000_000d;
    return String.format(Locale.ROOT, "%.3fms", millis);
  }
}
