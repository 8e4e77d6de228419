package org.wireroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.grid.GridRegion;
import org.wireroute.routing.grid.OccupancyGrid;
import org.wireroute.routing.heuristic.GoalBoundHeuristic;
import org.wireroute.routing.heuristic.HeuristicFactory;
import org.wireroute.routing.heuristic.HeuristicType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A* search over a 4-connected occupancy grid.
 *
 * <p>Every move costs one step. Priority is {@code g + h} where {@code h} comes from the
 * configured {@link HeuristicType}; with {@link HeuristicType#NONE} the search is plain
 * uniform-cost. Search rules:</p>
 * <ul>
 * <li>Moves are up/down/left/right only, so the output is always orthogonal.</li>
 * <li>A closed cell is never reopened. With uniform step cost and a consistent heuristic
 * a cell is closed with its optimal {@code g}.</li>
 * <li>The start cell is expanded even if blocked, and the goal cell may be entered even if
 * blocked; wire terminals usually sit on an inflated component outline.</li>
 * <li>The search fails when the open set empties.</li>
 * </ul>
 */
public final class GridPathfinder {
    private static final Logger log = LoggerFactory.getLogger(GridPathfinder.class);

    private static final int NO_CELL = -1;
    private static final int[] DX = {-1, 1, 0, 0};
    private static final int[] DY = {0, 0, -1, 1};

    private final HeuristicType heuristicType;
    private final SearchBudget budget;

    /**
     * Creates a pathfinder.
     *
     * @param heuristicType heuristic mode.
     * @param budget expansion bound.
     */
    public GridPathfinder(HeuristicType heuristicType, SearchBudget budget) {
        this.heuristicType = Objects.requireNonNull(heuristicType, "heuristicType");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Creates an unbounded Manhattan A* pathfinder.
     */
    public GridPathfinder() {
        this(HeuristicType.MANHATTAN, SearchBudget.unbounded());
    }

    /**
     * Finds a cell path between the cells containing {@code start} and {@code end}.
     *
     * @param grid occupancy grid whose region contains both points.
     * @param start world start point.
     * @param end world end point.
     * @return path of cell anchors, or a not-found result.
     * @throws SearchBudget.BudgetExceededException when the expansion budget runs out.
     */
    public GridPath find(OccupancyGrid grid, Point start, Point end) {
        Objects.requireNonNull(grid, "grid");
        GridRegion region = grid.region();
        int sx = region.cellX(start.getX());
        int sy = region.cellY(start.getY());
        int gx = region.cellX(end.getX());
        int gy = region.cellY(end.getY());
        if (!region.inBounds(sx, sy) || !region.inBounds(gx, gy)) {
            log.debug("Endpoint outside grid region: start cell ({}, {}), goal cell ({}, {})", sx, sy, gx, gy);
            return GridPath.notFound(0);
        }

        int cellCount = grid.cellCount();
        int startCell = region.index(sx, sy);
        int goalCell = region.index(gx, gy);
        GoalBoundHeuristic heuristic = HeuristicFactory.create(heuristicType, region).bindGoal(goalCell);

        SearchQueue open = new SearchQueue(cellCount, cellCount);
        VisitedSet closed = new VisitedSet(cellCount);
        int[] parentByCell = new int[cellCount];
        Arrays.fill(parentByCell, NO_CELL);

        open.insert(startCell, 0, heuristic.estimateFromCell(startCell), NO_CELL);
        int expanded = 0;

        while (!open.isEmpty()) {
            CellState state = open.extractMin();
            int cell = state.cellIndex;
            int g = state.gScore;
            int predecessor = state.predecessor;
            open.recycle(state);

            if (!closed.markVisited(cell)) {
                continue;
            }
            parentByCell[cell] = predecessor;
            expanded++;
            budget.checkExpandedCells(expanded);

            if (cell == goalCell) {
                List<Point> waypoints = reconstruct(region, parentByCell, goalCell);
                log.debug("Grid path found: {} waypoints, {} cells expanded", waypoints.size(), expanded);
                return new GridPath(true, waypoints, expanded);
            }

            int cx = region.column(cell);
            int cy = region.row(cell);
            for (int d = 0; d < DX.length; d++) {
                int nx = cx + DX[d];
                int ny = cy + DY[d];
                if (!region.inBounds(nx, ny)) {
                    continue;
                }
                int next = region.index(nx, ny);
                if (closed.isVisited(next)) {
                    continue;
                }
                if (next != goalCell && grid.isBlocked(next)) {
                    continue;
                }
                int nextG = g + 1;
                open.insert(next, nextG, nextG + heuristic.estimateFromCell(next), cell);
            }
        }

        log.debug("No grid path: open set exhausted after {} cells", expanded);
        return GridPath.notFound(expanded);
    }

    /**
     * Walks parent links back from the goal and returns anchors in start-to-goal order.
     */
    private static List<Point> reconstruct(GridRegion region, int[] parentByCell, int goalCell) {
        IntArrayList reversed = new IntArrayList();
        int cursor = goalCell;
        while (cursor != NO_CELL) {
            reversed.add(cursor);
            cursor = parentByCell[cursor];
        }
        List<Point> waypoints = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            int cell = reversed.getInt(i);
            waypoints.add(region.anchor(region.column(cell), region.row(cell)));
        }
        return waypoints;
    }
}
