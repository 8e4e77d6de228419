package org.wireroute.routing.grid;

import lombok.Value;

/**
 * Query-independent raster parameters.
 *
 * <p>{@link #defaults()} reads optional system-property overrides; anything missing,
 * malformed or non-positive keeps the built-in default.</p>
 */
@Value
public class GridSettings {
    public static final double DEFAULT_CELL_SIZE = 10.0d;
    public static final double DEFAULT_REGION_MARGIN = 100.0d;

    private static final String PROP_CELL_SIZE = "wireroute.routing.grid.cellSize";
    private static final String PROP_REGION_MARGIN = "wireroute.routing.grid.regionMargin";

    /** Edge length of one square cell in world units. */
    double cellSize;
    /** Extra space searched beyond the endpoint bounding box on every side. */
    double regionMargin;

    private GridSettings(double cellSize, double regionMargin) {
        this.cellSize = cellSize;
        this.regionMargin = regionMargin;
    }

    /**
     * Creates settings with explicit values.
     *
     * @throws IllegalArgumentException when a value is non-finite or not positive.
     */
    public static GridSettings of(double cellSize, double regionMargin) {
        if (!Double.isFinite(cellSize) || cellSize <= 0.0d) {
            throw new IllegalArgumentException("cellSize must be finite and > 0, got " + cellSize);
        }
        if (!Double.isFinite(regionMargin) || regionMargin <= 0.0d) {
            throw new IllegalArgumentException("regionMargin must be finite and > 0, got " + regionMargin);
        }
        return new GridSettings(cellSize, regionMargin);
    }

    /**
     * Loads settings from system properties, falling back to 10 / 100.
     */
    public static GridSettings defaults() {
        return of(
                readPositive(PROP_CELL_SIZE, DEFAULT_CELL_SIZE),
                readPositive(PROP_REGION_MARGIN, DEFAULT_REGION_MARGIN)
        );
    }

    private static double readPositive(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) && value > 0.0d ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
