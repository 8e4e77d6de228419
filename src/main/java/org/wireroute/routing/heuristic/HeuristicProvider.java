package org.wireroute.routing.heuristic;

/**
 * Heuristic provider contract used by the grid pathfinder.
 *
 * <p>Providers are bound to one grid region. Binding returns an immutable goal-bound
 * estimator.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds a concrete goal cell and returns a reusable estimator.
     *
     * @param goalCellIndex row-major goal cell index.
     * @return immutable estimator bound to the provided goal cell.
     */
    GoalBoundHeuristic bindGoal(int goalCellIndex);
}
