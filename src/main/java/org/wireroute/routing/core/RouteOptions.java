package org.wireroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call routing switches.
 */
@Value
@Builder
public class RouteOptions {
    /** Drawing style; every style is routed orthogonally. */
    @Builder.Default
    RoutingStyle routingStyle = RoutingStyle.ORTHOGONAL;
    /** Whether registered obstacles should be avoided. */
    @Builder.Default
    boolean avoidObstacles = true;
    /** Whether collinear segments are merged before evaluation. */
    @Builder.Default
    boolean optimize = true;

    /**
     * Orthogonal style, obstacle avoidance and optimization enabled.
     */
    public static RouteOptions defaults() {
        return RouteOptions.builder().build();
    }
}
