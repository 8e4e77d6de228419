package org.wireroute.routing.core;

import org.wireroute.routing.geometry.Point;

import java.util.List;

/**
 * Public wire routing contract.
 *
 * <p>Implementations validate input deterministically and throw
 * {@link WireRoutingException} for contract failures. An unreachable target is not a
 * failure; it yields the best available orthogonal route.</p>
 */
public interface WireRouter {
    /**
     * Routes one wire.
     *
     * @param start wire start.
     * @param end wire end.
     * @param options per-call switches; {@code null} means defaults.
     * @return routing result.
     */
    RoutingResult routeWire(Point start, Point end, RouteOptions options);

    /**
     * Routes one wire with default options.
     */
    default RoutingResult routeWire(Point start, Point end) {
        return routeWire(start, end, RouteOptions.defaults());
    }

    /**
     * Routes independent wires in order.
     *
     * @param requests batch in caller order.
     * @return one result per request, same order.
     */
    List<RoutingResult> routeWires(List<WireRequest> requests);
}
