package org.wireroute.routing.geometry;

/**
 * Axis of an orthogonal wire segment.
 */
public enum Orientation {
    HORIZONTAL,
    VERTICAL
}
