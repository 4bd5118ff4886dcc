package hunter.loadout.core.optimizer;

import hunter.loadout.core.domain.result.SolveStatus;
import org.chocosolver.solver.Solution;

/**
 * Best recorded assignment and whether every objective stage was proven optimal.
 *
 * @param solution recorded assignment of the last completed stage
 * @param status OPTIMAL or FEASIBLE
 */
record SolveOutcome(Solution solution, SolveStatus status) {}
