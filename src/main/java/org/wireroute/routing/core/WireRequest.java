package org.wireroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.wireroute.routing.geometry.Point;

/**
 * One wire in a batch routing call.
 */
@Value
@Builder
public class WireRequest {
    /** Caller label used in log output. */
    String id;
    Point start;
    Point end;
    /** Optional; defaults apply when null. */
    RouteOptions options;
}
