package org.wireroute.routing.obstacle;

import lombok.Builder;
import lombok.Value;
import org.wireroute.routing.geometry.Rectangle;

/**
 * Partial obstacle change. Null fields keep the current value.
 */
@Value
@Builder
public class ObstacleUpdate {
    Rectangle bounds;
    ObstacleType type;
    Integer priority;

    /**
     * Merges this update over an existing obstacle. The id never changes.
     *
     * @param existing current registry entry.
     * @return merged copy.
     */
    public RoutingObstacle applyTo(RoutingObstacle existing) {
        RoutingObstacle.RoutingObstacleBuilder builder = existing.toBuilder();
        if (bounds != null) {
            builder.bounds(bounds);
        }
        if (type != null) {
            builder.type(type);
        }
        if (priority != null) {
            builder.priority(priority);
        }
        return builder.build();
    }

    /**
     * Convenience update that only moves or resizes an obstacle.
     */
    public static ObstacleUpdate bounds(Rectangle bounds) {
        return ObstacleUpdate.builder().bounds(bounds).build();
    }
}
