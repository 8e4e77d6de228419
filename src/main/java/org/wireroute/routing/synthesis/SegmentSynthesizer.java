package org.wireroute.routing.synthesis;

import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.WireSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns endpoints or grid waypoints into orthogonal wire segments.
 *
 * <p>Zero-length legs are never emitted, so every produced list already satisfies the
 * no-empty-segment rule even when the optimization pass is skipped.</p>
 */
public final class SegmentSynthesizer {

    /**
     * Builds the unobstructed L-route.
     *
     * <p>The dominant axis is horizontal when {@code |dx| >= |dy|}, otherwise vertical. The wire
     * runs along the dominant axis first and turns once at most.</p>
     *
     * @return zero, one or two segments from {@code start} to {@code end}.
     */
    public List<WireSegment> direct(Point start, Point end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        double dx = Math.abs(end.getX() - start.getX());
        double dy = Math.abs(end.getY() - start.getY());
        Point corner = dx >= dy
                ? Point.of(end.getX(), start.getY())
                : Point.of(start.getX(), end.getY());
        List<WireSegment> segments = new ArrayList<>(2);
        appendLeg(segments, start, corner);
        appendLeg(segments, corner, end);
        return segments;
    }

    /**
     * Converts grid waypoints into one segment per grid step, anchored to the exact endpoints.
     *
     * <p>Waypoints are cell anchors, so {@code start} and {@code end} generally sit inside the
     * first and last cell rather than on them. A lead-in from {@code start} to the first anchor and
     * a lead-out from the last anchor to {@code end} are added, each as a horizontal then a vertical
     * leg inside the terminal cell.</p>
     *
     * @param start exact wire start.
     * @param end exact wire end.
     * @param waypoints cell anchors in path order, at least two.
     */
    public List<WireSegment> fromGridPath(Point start, Point end, List<Point> waypoints) {
        Objects.requireNonNull(waypoints, "waypoints");
        if (waypoints.size() < 2) {
            throw new IllegalArgumentException("grid path needs at least two waypoints, got " + waypoints.size());
        }
        List<WireSegment> segments = new ArrayList<>(waypoints.size() + 3);

        Point first = waypoints.get(0);
        appendStub(segments, start, first);
        for (int i = 0; i < waypoints.size() - 1; i++) {
            appendLeg(segments, waypoints.get(i), waypoints.get(i + 1));
        }
        appendStub(segments, waypoints.get(waypoints.size() - 1), end);
        return segments;
    }

    private static void appendStub(List<WireSegment> segments, Point from, Point to) {
        Point corner = Point.of(to.getX(), from.getY());
        appendLeg(segments, from, corner);
        appendLeg(segments, corner, to);
    }

    private static void appendLeg(List<WireSegment> segments, Point from, Point to) {
        WireSegment segment = WireSegment.between(from, to);
        if (!segment.isZeroLength()) {
            segments.add(segment);
        }
    }
}
