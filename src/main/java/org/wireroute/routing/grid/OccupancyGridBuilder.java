package org.wireroute.routing.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wireroute.routing.geometry.Rectangle;
import org.wireroute.routing.obstacle.RoutingObstacle;

import java.util.BitSet;
import java.util.Objects;

/**
 * Rasterizes obstacles into an {@link OccupancyGrid}.
 *
 * <p>Each obstacle is inflated by the avoidance margin and every cell whose footprint
 * touches the inflated rectangle is blocked. Obstacles entirely outside the region are
 * skipped, so build cost depends on the query window rather than on scene size.</p>
 */
public final class OccupancyGridBuilder {
    private static final Logger log = LoggerFactory.getLogger(OccupancyGridBuilder.class);

    /**
     * Builds one grid.
     *
     * @param region raster window.
     * @param obstacles obstacles to rasterize.
     * @param avoidanceMargin clearance added around every obstacle.
     * @param obstacleGeneration registry generation the obstacles were read at.
     * @return freshly built grid.
     */
    public OccupancyGrid build(
            GridRegion region,
            Iterable<RoutingObstacle> obstacles,
            double avoidanceMargin,
            long obstacleGeneration
    ) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(obstacles, "obstacles");
        long cells = region.cellCount();
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid too large: " + cells + " cells");
        }

        BitSet blocked = new BitSet((int) cells);
        Rectangle footprint = region.bounds();
        int rasterized = 0;
        for (RoutingObstacle obstacle : obstacles) {
            Rectangle inflated = obstacle.getBounds().inflate(avoidanceMargin);
            if (!footprint.intersects(inflated)) {
                continue;
            }
            if (mark(region, inflated, blocked)) {
                rasterized++;
                log.trace("Rasterized obstacle {} as {}", obstacle.getId(), inflated);
            }
        }

        log.debug("Built {}x{} grid at ({}, {}): {} obstacles rasterized, {} cells blocked",
                region.getColumns(), region.getRows(), region.getOriginX(), region.getOriginY(),
                rasterized, blocked.cardinality());
        return new OccupancyGrid(region, obstacleGeneration, avoidanceMargin, blocked);
    }

    /**
     * Marks the clamped cell span of one inflated rectangle.
     */
    private static boolean mark(GridRegion region, Rectangle inflated, BitSet blocked) {
        int startX = Math.max(0, region.cellX(inflated.getX()));
        int endX = Math.min(region.getColumns() - 1, region.cellX(inflated.right()));
        int startY = Math.max(0, region.cellY(inflated.getY()));
        int endY = Math.min(region.getRows() - 1, region.cellY(inflated.bottom()));
        if (startX > endX || startY > endY) {
            return false;
        }
        for (int cy = startY; cy <= endY; cy++) {
            int rowBase = region.index(startX, cy);
            blocked.set(rowBase, rowBase + (endX - startX) + 1);
        }
        return true;
    }
}
