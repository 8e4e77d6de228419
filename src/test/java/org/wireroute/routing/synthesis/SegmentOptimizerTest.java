package org.wireroute.routing.synthesis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wireroute.routing.geometry.Orientation;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.WireSegment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Segment Optimizer Tests")
class SegmentOptimizerTest {

    private final SegmentOptimizer optimizer = new SegmentOptimizer();

    private static WireSegment seg(double x1, double y1, double x2, double y2) {
        return WireSegment.between(Point.of(x1, y1), Point.of(x2, y2));
    }

    @Test
    @DisplayName("Collinear runs collapse into one segment each")
    void testMergeRuns() {
        List<WireSegment> optimized = optimizer.optimize(List.of(
                seg(0, 0, 10, 0),
                seg(10, 0, 30, 0),
                seg(30, 0, 30, 20),
                seg(30, 20, 30, 25)
        ));

        assertEquals(List.of(seg(0, 0, 30, 0), seg(30, 0, 30, 25)), optimized);
        assertEquals(30.0d, optimized.get(0).getLength(), 1e-9);
        assertEquals(Orientation.VERTICAL, optimized.get(1).getOrientation());
    }

    @Test
    @DisplayName("Second pass is a no-op")
    void testIdempotent() {
        List<WireSegment> once = optimizer.optimize(List.of(
                seg(0, 0, 10, 0),
                seg(10, 0, 10, 10),
                seg(10, 10, 10, 40),
                seg(10, 40, 20, 40),
                seg(20, 40, 50, 40)
        ));
        assertEquals(once, optimizer.optimize(once));
        assertEquals(3, once.size());
    }

    @Test
    @DisplayName("Back-tracking collapses to the net span")
    void testBacktrackingCollapses() {
        List<WireSegment> optimized = optimizer.optimize(List.of(
                seg(3, 0, 0, 0),
                seg(0, 0, 10, 0),
                seg(10, 0, 10, 10)
        ));

        assertEquals(List.of(seg(3, 0, 10, 0), seg(10, 0, 10, 10)), optimized);
        assertEquals(7.0d, optimized.get(0).getLength(), 1e-9, "length follows the endpoints");
    }

    @Test
    @DisplayName("A run that cancels out disappears and neighbours rejoin")
    void testCancellingRun() {
        List<WireSegment> optimized = optimizer.optimize(List.of(
                seg(0, 0, 10, 0),
                seg(10, 0, 10, 5),
                seg(10, 5, 10, 0),
                seg(10, 0, 20, 0)
        ));

        assertEquals(List.of(seg(0, 0, 20, 0)), optimized);
    }

    @Test
    @DisplayName("Zero-length input segments are dropped")
    void testDropsZeroLength() {
        List<WireSegment> optimized = optimizer.optimize(List.of(
                seg(0, 0, 0, 0),
                seg(0, 0, 0, 10),
                seg(0, 10, 0, 10)
        ));
        assertEquals(List.of(seg(0, 0, 0, 10)), optimized);
        assertTrue(optimizer.optimize(List.of()).isEmpty());
    }
}
