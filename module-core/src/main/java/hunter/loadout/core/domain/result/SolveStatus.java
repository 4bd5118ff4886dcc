package hunter.loadout.core.domain.result;

public enum SolveStatus {
  /** every objective stage was proven optimal */
  OPTIMAL,
  /** the time limit hit after a solution was found; optimality not proven */
  FEASIBLE
}
