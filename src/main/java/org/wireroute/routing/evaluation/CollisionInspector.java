package org.wireroute.routing.evaluation;

import org.wireroute.routing.geometry.WireSegment;
import org.wireroute.routing.obstacle.RoutingObstacle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports obstacles a finished route passes through.
 *
 * <p>A segment collides with an obstacle when it enters the open interior of the obstacle's
 * raw (un-inflated) bounds. Running along an edge or ending on it, as a wire attached to a
 * component terminal does, is not a collision.</p>
 */
public final class CollisionInspector {

    /**
     * Returns ids of obstacles crossed by any segment, in obstacle order.
     */
    public List<String> collidingObstacleIds(List<WireSegment> segments, List<RoutingObstacle> obstacles) {
        Objects.requireNonNull(segments, "segments");
        Objects.requireNonNull(obstacles, "obstacles");
        List<String> colliding = new ArrayList<>();
        for (RoutingObstacle obstacle : obstacles) {
            for (WireSegment segment : segments) {
                if (obstacle.getBounds().intersectsInterior(
                        segment.minX(), segment.minY(), segment.maxX(), segment.maxY())) {
                    colliding.add(obstacle.getId());
                    break;
                }
            }
        }
        return List.copyOf(colliding);
    }
}
