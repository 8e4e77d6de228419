package org.wireroute.routing.obstacle;

/**
 * Kind of region a wire must avoid.
 */
public enum ObstacleType {
    /** Placed schematic component body. */
    COMPONENT,
    /** Previously routed wire. */
    WIRE,
    /** Explicit keep-out zone drawn by the user. */
    KEEPOUT
}
