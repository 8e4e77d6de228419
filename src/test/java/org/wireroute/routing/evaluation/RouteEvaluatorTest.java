package org.wireroute.routing.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.WireSegment;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Route Evaluator Tests")
class RouteEvaluatorTest {

    private final RouteEvaluator evaluator = new RouteEvaluator();

    @Test
    @DisplayName("L-route has one bend and full quality")
    void testLRoute() {
        Point start = Point.of(0, 0);
        Point end = Point.of(100, 50);
        RouteMetrics metrics = evaluator.evaluate(List.of(
                WireSegment.between(start, Point.of(100, 0)),
                WireSegment.between(Point.of(100, 0), end)
        ), start, end);

        assertEquals(150.0d, metrics.totalLength(), 1e-9);
        assertEquals(1, metrics.bendCount());
        assertEquals(1.0d, metrics.quality(), 1e-9);
    }

    @Test
    @DisplayName("Empty route scores zero length, zero bends and full quality")
    void testEmptyRoute() {
        RouteMetrics metrics = evaluator.evaluate(List.of(), Point.of(5, 5), Point.of(5, 5));
        assertEquals(0.0d, metrics.totalLength(), 0.0d);
        assertEquals(0, metrics.bendCount());
        assertEquals(1.0d, metrics.quality(), 0.0d);
    }

    @Test
    @DisplayName("Bends beyond two cost 0.1 each and a long detour costs 0.2")
    void testPenalties() {
        assertEquals(1.0d, RouteEvaluator.quality(100, 2, 100), 1e-9);
        assertEquals(0.9d, RouteEvaluator.quality(100, 3, 100), 1e-9);
        assertEquals(0.6d, RouteEvaluator.quality(100, 6, 100), 1e-9);
        assertEquals(1.0d, RouteEvaluator.quality(150, 0, 100), 1e-9, "exactly 1.5x is not a detour");
        assertEquals(0.8d, RouteEvaluator.quality(151, 0, 100), 1e-9);
        assertEquals(0.4d, RouteEvaluator.quality(200, 6, 100), 1e-9);
    }

    @Test
    @DisplayName("Quality is clamped and never increases with more bends")
    void testMonotoneAndClamped() {
        double previous = 1.0d;
        for (int bends = 0; bends <= 20; bends++) {
            double quality = RouteEvaluator.quality(500, bends, 100);
            assertTrue(quality <= previous + 1e-12);
            assertTrue(quality >= 0.0d && quality <= 1.0d);
            previous = quality;
        }
        assertEquals(0.0d, RouteEvaluator.quality(500, 20, 100), 0.0d);
    }

    @Test
    @DisplayName("Bend count follows segment count")
    void testBendCount() {
        List<WireSegment> staircase = new ArrayList<>();
        Point cursor = Point.of(0, 0);
        for (int i = 0; i < 5; i++) {
            Point next = i % 2 == 0 ? Point.of(cursor.getX() + 10, cursor.getY()) : Point.of(cursor.getX(), cursor.getY() + 10);
            staircase.add(WireSegment.between(cursor, next));
            cursor = next;
        }
        RouteMetrics metrics = evaluator.evaluate(staircase, Point.of(0, 0), cursor);
        assertEquals(4, metrics.bendCount());
        assertEquals(0.8d, metrics.quality(), 1e-9);
    }
}
