package org.wireroute.routing.geometry;

import lombok.Value;

import java.util.Objects;

/**
 * Immutable axis-aligned piece of a routed wire.
 *
 * <p>A route is an ordered list of segments where each segment starts at the end of
 * its predecessor.</p>
 */
@Value
public class WireSegment {
    Point start;
    Point end;
    Orientation orientation;
    double length;

    /**
     * Creates a segment between two points sharing an x or y coordinate.
     *
     * <p>Orientation is vertical when the x coordinates match and horizontal otherwise.
     * Length is the Manhattan distance, which equals the Euclidean distance for
     * axis-aligned endpoints.</p>
     */
    public static WireSegment between(Point start, Point end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Orientation orientation = start.getX() == end.getX() ? Orientation.VERTICAL : Orientation.HORIZONTAL;
        return new WireSegment(start, end, orientation, start.manhattanDistance(end));
    }

    /**
     * Returns whether the segment collapses to a point.
     */
    public boolean isZeroLength() {
        return length == 0.0d;
    }

    public double minX() {
        return Math.min(start.getX(), end.getX());
    }

    public double maxX() {
        return Math.max(start.getX(), end.getX());
    }

    public double minY() {
        return Math.min(start.getY(), end.getY());
    }

    public double maxY() {
        return Math.max(start.getY(), end.getY());
    }
}
