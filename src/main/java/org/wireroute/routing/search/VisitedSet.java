package org.wireroute.routing.search;

import java.util.BitSet;

/**
 * Closed set of grid cells backed by a {@link BitSet} (~1 bit per cell).
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected number of cells, to avoid resizing.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
    }

    /**
     * Marks a cell as visited if it hasn't been visited already.
     *
     * @param cellIndex row-major cell index.
     * @return {@code true} if the cell was NOT previously visited.
     */
    public boolean markVisited(int cellIndex) {
        if (visited.get(cellIndex)) {
            return false;
        }
        visited.set(cellIndex);
        return true;
    }

    public boolean isVisited(int cellIndex) {
        return visited.get(cellIndex);
    }

    /**
     * Number of cells marked so far.
     */
    public int count() {
        return visited.cardinality();
    }

    public void clear() {
        visited.clear();
    }
}
