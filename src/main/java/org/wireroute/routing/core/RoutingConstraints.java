package org.wireroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Routing policy knobs.
 *
 * <p>Only {@code avoidanceMargin} is consumed by the router today. The spacing and bend
 * fields are carried for diagram tooling and are not enforced by the search.</p>
 */
@Value
@Builder(toBuilder = true)
public class RoutingConstraints {
    /** Minimum gap between parallel wires. Not enforced. */
    @Builder.Default
    double minWireSpacing = 10.0d;
    /** Preferred gap between parallel wires. Not enforced. */
    @Builder.Default
    double preferredWireSpacing = 20.0d;
    /** Upper bound on bends per wire. Not enforced. */
    @Builder.Default
    int maxBendCount = 6;
    /** Corner radius used when drawing bends. Not enforced. */
    @Builder.Default
    double preferredBendRadius = 5.0d;
    /** Clearance added around every obstacle before rasterization. */
    @Builder.Default
    double avoidanceMargin = 5.0d;

    public static RoutingConstraints defaults() {
        return RoutingConstraints.builder().build();
    }
}
