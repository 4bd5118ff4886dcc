package hunter.loadout.infrastructure.executor;

import java.util.Objects;

/**
 * 로그/메트릭용 작업 컨텍스트
 *
 * <p>TaskName을 구조화하여 동적 값과 고정 Taxonomy를 분리합니다.
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("Loadout", "optimize", "skills=3")
 *   → "Loadout:optimize:skills=3"
 * - TaskContext.of("Catalog", "load")
 *   → "Catalog:load"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 가능한 고정 값
 *   <li>dynamicValue: 로그에만 기록
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "Loadout", "Catalog")
 * @param operation 작업 유형 (예: "optimize", "load")
 * @param dynamicValue 동적 값 (예: 요청 요약, 파일 위치)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /**
   * @return "component:operation:dynamicValue" 형식의 문자열 (동적 값이 없으면 "component:operation")
   */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
