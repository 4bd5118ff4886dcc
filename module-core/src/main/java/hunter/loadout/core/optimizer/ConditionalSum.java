package hunter.loadout.core.optimizer;

import java.util.ArrayList;
import java.util.List;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.variables.IntVar;

/**
 * {@code Σ coefficient × variable} 선형 집계 빌딩 블록
 *
 * <p>선택 변수(BoolVar) 또는 사용량 변수(IntVar)에 계수를 곱해 합산합니다. 선택되지 않은 항목은 변수 값이 0이므로 별도의 함의 제약 없이
 * 기여도가 0이 됩니다.
 *
 * <h3>사용처</h3>
 *
 * <ul>
 *   <li>스킬별 raw 포인트 (장비, 호석, 무기, 장식주 사용량)
 *   <li>(풀, 티어)별 사용 가능 슬롯 수 및 배치 수
 *   <li>목적 함수 항
 * </ul>
 *
 * <p>계수는 0 이상이어야 하며 0인 항은 무시됩니다.
 */
final class ConditionalSum {

  private final List<IntVar> variables = new ArrayList<>();
  private final List<Integer> coefficients = new ArrayList<>();
  private long upperBound;

  ConditionalSum add(int coefficient, IntVar variable) {
    if (coefficient < 0) {
      throw new IllegalArgumentException("coefficient must be non-negative, got: " + coefficient);
    }
    if (coefficient == 0 || variable.getUB() == 0) {
      return this;
    }
    variables.add(variable);
    coefficients.add(coefficient);
    upperBound += (long) coefficient * variable.getUB();
    return this;
  }

  boolean isEmpty() {
    return variables.isEmpty();
  }

  /** Largest value the sum can take given the current variable domains. */
  long upperBound() {
    return upperBound;
  }

  /** Posts the sum into a new result variable bounded by the natural upper bound. */
  IntVar post(Model model, String name) {
    return post(model, name, upperBound);
  }

  /**
   * Posts the sum into a new result variable.
   *
   * @param boundHint tighter upper bound known to the caller (e.g. exactly-one groups); the result
   *     domain is {@code [0, min(boundHint, natural bound)]}
   */
  IntVar post(Model model, String name, long boundHint) {
    if (isEmpty()) {
      return model.intVar(name, 0);
    }
    long bound = Math.min(boundHint, upperBound);
    if (bound > IntVar.MAX_INT_BOUND) {
      throw new IllegalStateException(
          "sum '" + name + "' exceeds the solver integer domain: " + bound);
    }
    IntVar result = model.intVar(name, 0, (int) bound, true);
    model
        .scalar(
            variables.toArray(new IntVar[0]),
            coefficients.stream().mapToInt(Integer::intValue).toArray(),
            "=",
            result)
        .post();
    return result;
  }
}
