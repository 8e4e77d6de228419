package org.wireroute.routing.core;

/**
 * Which strategy produced a route's segments.
 */
public enum RouteSource {
    /** Unobstructed L-route; no search was needed or avoidance was off. */
    DIRECT,
    /** A* over the occupancy grid found a path. */
    GRID_SEARCH,
    /** The search failed or ran out of budget and the L-route was used instead. */
    FALLBACK_DIRECT
}
