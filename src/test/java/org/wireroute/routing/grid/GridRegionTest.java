package org.wireroute.routing.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.Rectangle;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Region Tests")
class GridRegionTest {

    private static final GridSettings SETTINGS = GridSettings.of(10, 100);

    @Test
    @DisplayName("Window is the endpoint box grown by the margin")
    void testAround() {
        GridRegion region = GridRegion.around(Point.of(100, 0), Point.of(0, 0), SETTINGS);

        assertEquals(-100.0d, region.getOriginX(), 1e-9);
        assertEquals(-100.0d, region.getOriginY(), 1e-9);
        assertEquals(30, region.getColumns());
        assertEquals(20, region.getRows());
        assertEquals(600L, region.cellCount());
        assertEquals(Rectangle.of(-100, -100, 300, 200), region.bounds());
    }

    @Test
    @DisplayName("Partial extents round up to a whole cell")
    void testCeilCellCount() {
        GridRegion region = GridRegion.around(Point.of(0, 0), Point.of(5, 0), SETTINGS);
        assertEquals(21, region.getColumns(), "205 units need 21 cells");
        assertEquals(20, region.getRows());
    }

    @Test
    @DisplayName("World to cell mapping floors toward the origin")
    void testCellMapping() {
        GridRegion region = GridRegion.around(Point.of(0, 0), Point.of(100, 0), SETTINGS);

        assertEquals(10, region.cellX(0));
        assertEquals(10, region.cellX(9.99));
        assertEquals(9, region.cellX(-0.01));
        assertEquals(-1, region.cellX(-100.5));
        assertFalse(region.inBounds(-1, 0));
        assertFalse(region.inBounds(30, 0));
        assertTrue(region.inBounds(29, 19));

        int index = region.index(7, 3);
        assertEquals(7, region.column(index));
        assertEquals(3, region.row(index));
        assertEquals(Point.of(-30, -70), region.anchor(7, 3));
    }

    @Test
    @DisplayName("Coverage requires the same cell size and a containing footprint")
    void testCovers() {
        GridRegion wide = GridRegion.around(Point.of(0, 0), Point.of(100, 100), SETTINGS);
        GridRegion inner = GridRegion.around(Point.of(20, 20), Point.of(80, 80), SETTINGS);
        GridRegion shifted = GridRegion.around(Point.of(50, 50), Point.of(300, 50), SETTINGS);
        GridRegion coarse = GridRegion.around(Point.of(20, 20), Point.of(80, 80), GridSettings.of(20, 100));

        assertTrue(wide.covers(inner));
        assertTrue(wide.covers(wide));
        assertFalse(inner.covers(wide));
        assertFalse(wide.covers(shifted));
        assertFalse(wide.covers(coarse));
    }

    @Test
    @DisplayName("Cell count estimate matches the built window and saturates when huge")
    void testCellCountAround() {
        Point a = Point.of(5, -20);
        Point b = Point.of(-37, 61);
        assertEquals(GridRegion.around(a, b, SETTINGS).cellCount(), GridRegion.cellCountAround(a, b, SETTINGS));
        assertEquals(2_502_000_400L, GridRegion.cellCountAround(Point.of(0, 0), Point.of(500_000, 500_000), SETTINGS));
        assertEquals(Long.MAX_VALUE, GridRegion.cellCountAround(Point.of(-1e300, 0), Point.of(1e300, 1e300), SETTINGS));
    }
}
