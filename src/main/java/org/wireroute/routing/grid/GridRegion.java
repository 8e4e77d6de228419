package org.wireroute.routing.grid;

import lombok.Value;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.Rectangle;

/**
 * World-space window covered by one occupancy grid.
 *
 * <p>Cell {@code (cx, cy)} spans {@code [originX + cx*cell, originX + (cx+1)*cell)} and the
 * same in y. Its anchor, the point waypoints are emitted at, is the minimum corner.</p>
 */
@Value
public class GridRegion {
    double originX;
    double originY;
    int columns;
    int rows;
    double cellSize;

    /**
     * Computes the search window for one endpoint pair: the pair's bounding box grown by
     * the configured margin, split into {@code ceil(extent / cellSize)} cells per axis.
     */
    public static GridRegion around(Point start, Point end, GridSettings settings) {
        double margin = settings.getRegionMargin();
        double cell = settings.getCellSize();
        double minX = Math.min(start.getX(), end.getX()) - margin;
        double maxX = Math.max(start.getX(), end.getX()) + margin;
        double minY = Math.min(start.getY(), end.getY()) - margin;
        double maxY = Math.max(start.getY(), end.getY()) + margin;
        int columns = toCellCount(maxX - minX, cell);
        int rows = toCellCount(maxY - minY, cell);
        return new GridRegion(minX, minY, columns, rows, cell);
    }

    /**
     * Cell count {@link #around} would produce, saturating at {@link Long#MAX_VALUE} instead of
     * failing for windows too large to index.
     */
    public static long cellCountAround(Point start, Point end, GridSettings settings) {
        double margin = settings.getRegionMargin();
        double cell = settings.getCellSize();
        double columns = Math.max(1.0d, Math.ceil((Math.abs(end.getX() - start.getX()) + 2.0d * margin) / cell));
        double rows = Math.max(1.0d, Math.ceil((Math.abs(end.getY() - start.getY()) + 2.0d * margin) / cell));
        double cells = columns * rows;
        return cells >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) cells;
    }

    private static int toCellCount(double extent, double cell) {
        double count = Math.ceil(extent / cell);
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid extent too large: " + extent);
        }
        return Math.max(1, (int) count);
    }

    /**
     * Full footprint of the raster, including the partial last row/column.
     */
    public Rectangle bounds() {
        return Rectangle.of(originX, originY, columns * cellSize, rows * cellSize);
    }

    /**
     * Returns whether this window can serve a query that needs {@code other}.
     */
    public boolean covers(GridRegion other) {
        return Double.compare(cellSize, other.cellSize) == 0 && bounds().contains(other.bounds());
    }

    public long cellCount() {
        return (long) columns * rows;
    }

    public int cellX(double worldX) {
        return (int) Math.floor((worldX - originX) / cellSize);
    }

    public int cellY(double worldY) {
        return (int) Math.floor((worldY - originY) / cellSize);
    }

    public boolean inBounds(int cx, int cy) {
        return cx >= 0 && cx < columns && cy >= 0 && cy < rows;
    }

    public int index(int cx, int cy) {
        return cy * columns + cx;
    }

    public int column(int index) {
        return index % columns;
    }

    public int row(int index) {
        return index / columns;
    }

    /**
     * World anchor of a cell (its minimum corner).
     */
    public Point anchor(int cx, int cy) {
        return Point.of(originX + cx * cellSize, originY + cy * cellSize);
    }
}
