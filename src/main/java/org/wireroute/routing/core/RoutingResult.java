package org.wireroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.wireroute.routing.geometry.WireSegment;
import org.wireroute.routing.obstacle.RoutingObstacle;

import java.util.List;

/**
 * Outcome of one routing call.
 *
 * <p>{@code quality == 1} does not imply the route is obstacle-free: a fallback route
 * ignores obstacles. Check {@link #getSource()} or {@link #getCollidingObstacleIds()} when
 * that matters.</p>
 */
@Value
@Builder
public class RoutingResult {
    /** Ordered, connected, axis-aligned segments from start to end. */
    @Singular
    List<WireSegment> segments;
    /** Sum of segment lengths. */
    double totalLength;
    /** {@code max(0, segments - 1)}. */
    int bendCount;
    /** Advisory score in {@code [0, 1]}. */
    double quality;
    /** Obstacles registered when the route was computed. */
    @Singular
    List<RoutingObstacle> obstacles;
    /** Strategy that produced the segments. */
    RouteSource source;
    /** Cells closed by the grid search (zero when no search ran). */
    int expandedCells;
    /** Obstacles whose interior the route crosses. */
    @Singular
    List<String> collidingObstacleIds;

    /**
     * Returns whether the route crosses any obstacle.
     */
    public boolean hasCollisions() {
        return !collidingObstacleIds.isEmpty();
    }
}
