package hunter.loadout.core.optimizer;

import java.util.List;
import org.chocosolver.solver.variables.IntVar;

/**
 * Composed objective.
 *
 * <p>{@code stages} holds one scalar objective when the scale-separated sum fits the solver
 * domain, otherwise the three terms in priority order, maximized one after another.
 *
 * @param primary Σ weight × capped level
 * @param secondary Σ tier weight × free slots
 * @param tertiary Σ effective level
 * @param stages variables to maximize, in order
 * @param tierWeights weight of one free slot per tier (index = tier)
 * @param secondaryScale S_secondary
 * @param primaryScale S_primary
 */
record ObjectivePlan(
    IntVar primary,
    IntVar secondary,
    IntVar tertiary,
    List<IntVar> stages,
    long[] tierWeights,
    long secondaryScale,
    long primaryScale) {

  boolean isLexicographic() {
    return stages.size() > 1;
  }
}
