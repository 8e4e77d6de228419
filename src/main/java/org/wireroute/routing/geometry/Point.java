package org.wireroute.routing.geometry;

import lombok.Value;

/**
 * Immutable canvas coordinate in world units.
 */
@Value(staticConstructor = "of")
public class Point {
    double x;
    double y;

    /**
     * Returns whether both coordinates are finite.
     */
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    /**
     * Computes {@code |dx| + |dy|} to another point.
     */
    public double manhattanDistance(Point other) {
        return Math.abs(other.x - x) + Math.abs(other.y - y);
    }
}
