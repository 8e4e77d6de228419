package org.wireroute.routing.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.BitSet;
import java.util.Objects;

/**
 * Binary free/blocked raster for one {@link GridRegion}.
 *
 * <p>The grid remembers the obstacle generation and avoidance margin it was built
 * with so the owner can tell whether it is still valid.</p>
 */
public final class OccupancyGrid {
    @Getter
    @Accessors(fluent = true)
    private final GridRegion region;
    @Getter
    @Accessors(fluent = true)
    private final long obstacleGeneration;
    @Getter
    @Accessors(fluent = true)
    private final double avoidanceMargin;

    private final BitSet blocked;

    OccupancyGrid(GridRegion region, long obstacleGeneration, double avoidanceMargin, BitSet blocked) {
        this.region = Objects.requireNonNull(region, "region");
        this.obstacleGeneration = obstacleGeneration;
        this.avoidanceMargin = avoidanceMargin;
        this.blocked = Objects.requireNonNull(blocked, "blocked");
    }

    /**
     * Returns whether this grid may answer a query needing {@code queryRegion} given the
     * current obstacle generation and avoidance margin.
     */
    public boolean isValidFor(GridRegion queryRegion, long currentGeneration, double currentMargin) {
        return obstacleGeneration == currentGeneration
                && Double.compare(avoidanceMargin, currentMargin) == 0
                && region.covers(queryRegion);
    }

    public boolean isBlocked(int cx, int cy) {
        return blocked.get(region.index(cx, cy));
    }

    public boolean isBlocked(int cellIndex) {
        return blocked.get(cellIndex);
    }

    public int columns() {
        return region.getColumns();
    }

    public int rows() {
        return region.getRows();
    }

    public int cellCount() {
        return columns() * rows();
    }

    public int blockedCount() {
        return blocked.cardinality();
    }
}
