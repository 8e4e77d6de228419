package org.wireroute.routing.search;

import org.wireroute.routing.geometry.Point;

import java.util.List;

/**
 * Grid search output.
 *
 * @param found whether the goal cell was reached.
 * @param waypoints cell anchors from start cell to goal cell (empty when not found).
 * @param expandedCells number of cells closed during the search.
 */
public record GridPath(boolean found, List<Point> waypoints, int expandedCells) {

    public GridPath {
        waypoints = List.copyOf(waypoints);
    }

    /**
     * Creates a canonical not-found result.
     */
    public static GridPath notFound(int expandedCells) {
        return new GridPath(false, List.of(), expandedCells);
    }

    /**
     * Returns whether the path has fewer than two waypoints and cannot form a segment.
     */
    public boolean isDegenerate() {
        return waypoints.size() < 2;
    }
}
