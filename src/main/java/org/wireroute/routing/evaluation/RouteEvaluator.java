package org.wireroute.routing.evaluation;

import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.WireSegment;

import java.util.List;
import java.util.Objects;

/**
 * Scores a finished route.
 *
 * <p>Quality starts at 1.0, loses 0.1 per bend beyond the second and a flat 0.2 when the
 * route is longer than 1.5x the Manhattan distance between its endpoints, then is clamped
 * to {@code [0, 1]}. The score is advisory; it never feeds back into route selection.</p>
 */
public final class RouteEvaluator {
    static final int FREE_BENDS = 2;
    static final double BEND_PENALTY = 0.1d;
    static final double DETOUR_RATIO = 1.5d;
    static final double DETOUR_PENALTY = 0.2d;

    /**
     * Computes length, bend count and quality.
     *
     * @param segments final segment list.
     * @param start requested start point.
     * @param end requested end point.
     */
    public RouteMetrics evaluate(List<WireSegment> segments, Point start, Point end) {
        Objects.requireNonNull(segments, "segments");
        double totalLength = 0.0d;
        for (WireSegment segment : segments) {
            totalLength += segment.getLength();
        }
        int bendCount = Math.max(0, segments.size() - 1);
        double quality = quality(totalLength, bendCount, start.manhattanDistance(end));
        return new RouteMetrics(totalLength, bendCount, quality);
    }

    static double quality(double totalLength, int bendCount, double manhattanDistance) {
        double quality = 1.0d;
        quality -= BEND_PENALTY * Math.max(0, bendCount - FREE_BENDS);
        if (totalLength > DETOUR_RATIO * manhattanDistance) {
            quality -= DETOUR_PENALTY;
        }
        return Math.max(0.0d, Math.min(1.0d, quality));
    }
}
