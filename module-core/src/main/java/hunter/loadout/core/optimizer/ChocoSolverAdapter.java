package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.result.SolveStatus;
import hunter.loadout.error.exception.LoadoutInfeasibleException;
import hunter.loadout.error.exception.SolveCancelledException;
import hunter.loadout.error.exception.SolverInternalException;
import hunter.loadout.error.exception.SolverTimeoutException;
import hunter.loadout.error.exception.base.BaseException;
import org.chocosolver.solver.Model;
import org.chocosolver.solver.Solution;
import org.chocosolver.solver.Solver;
import org.chocosolver.solver.search.SearchState;
import org.chocosolver.solver.variables.IntVar;
import org.chocosolver.util.criteria.Criterion;

/**
 * Choco 솔버 실행 어댑터
 *
 * <p>목적 단계마다 branch-and-bound로 최댓값을 구하고, 다음 단계로 넘어가기 전에 그 값을 등식 제약으로 고정합니다. 제한 시간과 취소
 * 훅은 모든 단계에 걸쳐 하나의 stop criterion으로 적용됩니다.
 *
 * <h3>결과 분류</h3>
 *
 * <ul>
 *   <li>모든 단계 완료 → {@link SolveStatus#OPTIMAL}
 *   <li>해를 찾은 뒤 시간 초과 → {@link SolveStatus#FEASIBLE}
 *   <li>해 없이 시간 초과 → {@link SolverTimeoutException}
 *   <li>탐색 완료, 해 없음 → {@link LoadoutInfeasibleException}
 *   <li>취소 → {@link SolveCancelledException} (부분 결과 없음)
 *   <li>솔버 예외 → {@link SolverInternalException}
 * </ul>
 */
public class ChocoSolverAdapter {

  SolveOutcome solve(LoadoutModel loadoutModel, ObjectivePlan plan, SolveOptions options) {
    Model model = loadoutModel.model();
    try {
      return runStages(model, plan, options);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SolverInternalException(model.getName(), e);
    }
  }

  private SolveOutcome runStages(Model model, ObjectivePlan plan, SolveOptions options) {
    Solver solver = model.getSolver();
    long deadline = System.nanoTime() + options.timeLimit().toNanos();
    Criterion stop = () -> System.nanoTime() >= deadline || options.isCancelled();

    Solution best = null;
    IntVar previous = null;
    for (IntVar objective : plan.stages()) {
      if (previous != null) {
        solver.reset();
        model.arithm(previous, "=", best.getIntVal(previous)).post();
      }
      solver.removeAllStopCriteria();
      solver.addStopCriterion(stop);

      Solution stageBest = maximize(model, solver, objective);
      if (options.isCancelled()) {
        throw new SolveCancelledException(model.getName());
      }
      boolean stopped = solver.getSearchState() == SearchState.STOPPED;
      if (stageBest == null) {
        if (!stopped) {
          throw new LoadoutInfeasibleException(model.getName());
        }
        if (best == null) {
          throw new SolverTimeoutException(options.timeLimit());
        }
        return new SolveOutcome(best, SolveStatus.FEASIBLE);
      }
      best = stageBest;
      if (stopped) {
        return new SolveOutcome(best, SolveStatus.FEASIBLE);
      }
      previous = objective;
    }
    return new SolveOutcome(best, SolveStatus.OPTIMAL);
  }

  private static Solution maximize(Model model, Solver solver, IntVar objective) {
    Solution stageBest = null;
    if (objective.isInstantiated()) {
      // 상수 목적: 최적화할 것이 없으므로 해 하나로 충분
      model.clearObjective();
      if (solver.solve()) {
        stageBest = new Solution(model);
        stageBest.record();
      }
      return stageBest;
    }
    model.setObjective(Model.MAXIMIZE, objective);
    while (solver.solve()) {
      if (stageBest == null) {
        stageBest = new Solution(model);
      }
      stageBest.record();
    }
    return stageBest;
  }
}
