package hunter.loadout.infrastructure.executor.policy;

/** 작업 로그 태그 상수 */
final class TaskLogTags {

  static final String TAG_START = "[Task:START]";

  static final String TAG_SUCCESS = "[Task:SUCCESS]";

  static final String TAG_SLOW = "[Task:SLOW]";

  static final String TAG_FAILURE = "[Task:FAILURE]";

  private TaskLogTags() {}
}
