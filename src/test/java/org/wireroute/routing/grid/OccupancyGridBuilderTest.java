package org.wireroute.routing.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.Rectangle;
import org.wireroute.routing.obstacle.RoutingObstacle;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Occupancy Grid Builder Tests")
class OccupancyGridBuilderTest {

    private final OccupancyGridBuilder builder = new OccupancyGridBuilder();
    private final GridRegion region = GridRegion.around(Point.of(0, 0), Point.of(100, 0), GridSettings.of(10, 100));

    private static RoutingObstacle obstacle(String id, Rectangle bounds) {
        return RoutingObstacle.builder().id(id).bounds(bounds).build();
    }

    @Test
    @DisplayName("Inflated obstacle blocks its clamped floor span")
    void testRasterizeInflated() {
        OccupancyGrid grid = builder.build(region, List.of(obstacle("u1", Rectangle.of(40, -30, 20, 60))), 5.0d, 7L);

        // inflated to [35, 65] x [-35, 35]: columns 13..16, rows 6..13
        assertEquals(4 * 8, grid.blockedCount());
        assertTrue(grid.isBlocked(13, 6));
        assertTrue(grid.isBlocked(16, 13));
        assertFalse(grid.isBlocked(12, 10));
        assertFalse(grid.isBlocked(17, 10));
        assertFalse(grid.isBlocked(14, 5));
        assertFalse(grid.isBlocked(14, 14));
        assertEquals(7L, grid.obstacleGeneration());
        assertEquals(5.0d, grid.avoidanceMargin(), 1e-9);
    }

    @Test
    @DisplayName("Margin changes the blocked footprint")
    void testMarginWidensFootprint() {
        List<RoutingObstacle> obstacles = List.of(obstacle("u1", Rectangle.of(40, -30, 20, 60)));
        OccupancyGrid tight = builder.build(region, obstacles, 0.0d, 1L);
        OccupancyGrid loose = builder.build(region, obstacles, 15.0d, 1L);

        assertTrue(loose.blockedCount() > tight.blockedCount());
        assertFalse(tight.isBlocked(12, 10));
        assertTrue(loose.isBlocked(12, 10));
    }

    @Test
    @DisplayName("Obstacles outside the window are skipped and partial ones clamped")
    void testSkipAndClamp() {
        OccupancyGrid grid = builder.build(region, List.of(
                obstacle("far", Rectangle.of(1000, 1000, 10, 10)),
                obstacle("edge", Rectangle.of(-150, -150, 60, 60))
        ), 0.0d, 1L);

        // "edge" covers [-150, -90] in both axes: columns 0..1, rows 0..1 after clamping
        assertEquals(4, grid.blockedCount());
        assertTrue(grid.isBlocked(0, 0));
        assertTrue(grid.isBlocked(1, 1));
        assertFalse(grid.isBlocked(2, 2));
    }

    @Test
    @DisplayName("Validity tracks generation, margin and coverage")
    void testValidity() {
        OccupancyGrid grid = builder.build(region, List.of(), 5.0d, 3L);
        GridRegion inner = GridRegion.around(Point.of(10, 0), Point.of(90, 0), GridSettings.of(10, 100));
        GridRegion outside = GridRegion.around(Point.of(0, 0), Point.of(500, 0), GridSettings.of(10, 100));

        assertTrue(grid.isValidFor(region, 3L, 5.0d));
        assertTrue(grid.isValidFor(inner, 3L, 5.0d));
        assertFalse(grid.isValidFor(region, 4L, 5.0d));
        assertFalse(grid.isValidFor(region, 3L, 6.0d));
        assertFalse(grid.isValidFor(outside, 3L, 5.0d));
        assertEquals(600, grid.cellCount());
    }
}
