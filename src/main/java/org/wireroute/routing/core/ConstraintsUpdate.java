package org.wireroute.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Partial constraints change. Null fields keep the current value.
 */
@Value
@Builder
public class ConstraintsUpdate {
    Double minWireSpacing;
    Double preferredWireSpacing;
    Integer maxBendCount;
    Double preferredBendRadius;
    Double avoidanceMargin;

    /**
     * Merges this update over the current constraints.
     */
    public RoutingConstraints applyTo(RoutingConstraints current) {
        RoutingConstraints.RoutingConstraintsBuilder builder = current.toBuilder();
        if (minWireSpacing != null) {
            builder.minWireSpacing(minWireSpacing);
        }
        if (preferredWireSpacing != null) {
            builder.preferredWireSpacing(preferredWireSpacing);
        }
        if (maxBendCount != null) {
            builder.maxBendCount(maxBendCount);
        }
        if (preferredBendRadius != null) {
            builder.preferredBendRadius(preferredBendRadius);
        }
        if (avoidanceMargin != null) {
            builder.avoidanceMargin(avoidanceMargin);
        }
        return builder.build();
    }
}
