package org.wireroute.routing.obstacle;

import lombok.Builder;
import lombok.Value;
import org.wireroute.routing.geometry.Rectangle;

/**
 * Rectangular region registered with the router.
 *
 * <p>Identity is the caller-assigned {@code id}. Instances are immutable; updates
 * publish a merged copy into the {@link ObstacleRegistry}.</p>
 */
@Value
@Builder(toBuilder = true)
public class RoutingObstacle {
    /** Caller-assigned unique identifier. */
    String id;
    /** World-space bounds before avoidance-margin inflation. */
    Rectangle bounds;
    /** Obstacle category. */
    @Builder.Default
    ObstacleType type = ObstacleType.COMPONENT;
    /** Caller priority, carried through for diagram tooling. */
    int priority;
}
