package org.wireroute.routing.heuristic;

import org.wireroute.routing.grid.GridRegion;

import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore behaves like plain Dijkstra
 * while still honoring bound-check contracts.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private final long cellCount;

    /**
     * Creates a null heuristic provider for one grid region.
     *
     * @param region region used for cell bound validation.
     */
    public NullHeuristicProvider(GridRegion region) {
        Objects.requireNonNull(region, "region");
        this.cellCount = region.cellCount();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalCellIndex) {
        if (goalCellIndex < 0 || goalCellIndex >= cellCount) {
            throw new IllegalArgumentException(
                    "goalCellIndex out of bounds: " + goalCellIndex + " [0, " + cellCount + ")"
            );
        }
        return cellIndex -> 0.0d;
    }
}
