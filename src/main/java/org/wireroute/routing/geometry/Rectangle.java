package org.wireroute.routing.geometry;

import lombok.Value;

/**
 * Axis-aligned bounding box anchored at its minimum corner.
 *
 * <p>Width and height are expected to be non-negative. Validation happens at the
 * registry boundary, so this type stays a plain value.</p>
 */
@Value(staticConstructor = "of")
public class Rectangle {
    double x;
    double y;
    double width;
    double height;

    /**
     * Returns the smallest rectangle containing both points.
     */
    public static Rectangle boundingBox(Point a, Point b) {
        double minX = Math.min(a.getX(), b.getX());
        double minY = Math.min(a.getY(), b.getY());
        return of(minX, minY, Math.max(a.getX(), b.getX()) - minX, Math.max(a.getY(), b.getY()) - minY);
    }

    /**
     * Maximum x coordinate.
     */
    public double right() {
        return x + width;
    }

    /**
     * Maximum y coordinate.
     */
    public double bottom() {
        return y + height;
    }

    /**
     * Grows the rectangle by {@code margin} on all four sides.
     */
    public Rectangle inflate(double margin) {
        return of(x - margin, y - margin, width + 2.0d * margin, height + 2.0d * margin);
    }

    /**
     * Returns whether {@code other} lies fully inside this rectangle (edges inclusive).
     */
    public boolean contains(Rectangle other) {
        return other.x >= x && other.y >= y && other.right() <= right() && other.bottom() <= bottom();
    }

    /**
     * Closed intersection test: touching edges count as intersecting.
     */
    public boolean intersects(Rectangle other) {
        return other.x <= right() && other.right() >= x && other.y <= bottom() && other.bottom() >= y;
    }

    /**
     * Returns whether the closed box {@code [minX, maxX] x [minY, maxY]} reaches into the open
     * interior of this rectangle. Degenerate boxes (segments) are allowed.
     */
    public boolean intersectsInterior(double minX, double minY, double maxX, double maxY) {
        return maxX > x && minX < right() && maxY > y && minY < bottom();
    }

    /**
     * Returns whether all components are finite and the size is non-negative.
     */
    public boolean isWellFormed() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width >= 0.0d && height >= 0.0d;
    }
}
