package org.wireroute.routing.heuristic;

import org.wireroute.routing.grid.GridRegion;

import java.util.Objects;

/**
 * Manhattan-distance heuristic in cell units.
 *
 * <p>With unit step cost and 4-neighbour moves this estimate never exceeds the true
 * remaining cost, and it changes by at most one per step, so A* settles every cell
 * with its optimal cost.</p>
 */
public final class ManhattanHeuristicProvider implements HeuristicProvider {
    private final int columns;
    private final long cellCount;

    /**
     * Creates a provider for one grid region.
     *
     * @param region region whose row-major indexing the estimator decodes.
     */
    public ManhattanHeuristicProvider(GridRegion region) {
        Objects.requireNonNull(region, "region");
        this.columns = region.getColumns();
        this.cellCount = region.cellCount();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.MANHATTAN;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalCellIndex) {
        validateCell(goalCellIndex, "goalCellIndex");
        return new BoundManhattanHeuristic(goalCellIndex % columns, goalCellIndex / columns);
    }

    private void validateCell(int cellIndex, String name) {
        if (cellIndex < 0 || cellIndex >= cellCount) {
            throw new IllegalArgumentException(
                    name + " out of bounds: " + cellIndex + " [0, " + cellCount + ")"
            );
        }
    }

    private final class BoundManhattanHeuristic implements GoalBoundHeuristic {
        private final int goalX;
        private final int goalY;

        private BoundManhattanHeuristic(int goalX, int goalY) {
            this.goalX = goalX;
            this.goalY = goalY;
        }

        @Override
        public double estimateFromCell(int cellIndex) {
            validateCell(cellIndex, "cellIndex");
            int x = cellIndex % columns;
            int y = cellIndex / columns;
            return Math.abs(x - goalX) + Math.abs(y - goalY);
        }
    }
}
