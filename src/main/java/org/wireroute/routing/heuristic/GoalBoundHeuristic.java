package org.wireroute.routing.heuristic;

/**
 * Immutable goal-bound heuristic estimator.
 *
 * <p>Hot path contract: {@link #estimateFromCell(int)} must avoid allocations.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining steps from a cell to a pre-bound goal.
     *
     * @param cellIndex row-major cell index.
     * @return admissible lower-bound estimate.
     */
    double estimateFromCell(int cellIndex);
}
