package org.wireroute.routing.search;

/**
 * Represents a mutable frontier entry of the grid search.
 * <p>
 * <strong>Design Pattern: Object Pooling</strong><br>
 * Instances are recycled by the {@link SearchQueue} so a search does not allocate
 * one object per pushed cell.
 * </p>
 */
public class CellState implements Comparable<CellState> {

    /** Row-major index of the cell in the occupancy grid. */
    public int cellIndex;

    /** Steps from the start cell ({@code g}). */
    public int gScore;

    /** Queue priority, {@code g + h}. */
    public double priority;

    /** Cell index this state was reached from, or {@code -1} for the start cell. */
    public int predecessor;

    /**
     * Default constructor.
     * Intended for pre-allocation within an object pool.
     */
    public CellState() {
        // Default constructor for pooling
    }

    /**
     * Re-initializes the state with new values.
     */
    public void set(int cellIndex, int gScore, double priority, int predecessor) {
        this.cellIndex = cellIndex;
        this.gScore = gScore;
        this.priority = priority;
        this.predecessor = predecessor;
    }

    /**
     * Compares two states for ordering in the priority queue.
     * <p>
     * <strong>Ordering Logic:</strong>
     * <ol>
     * <li><strong>Primary:</strong> Priority {@code f} (lower is better).</li>
     * <li><strong>Secondary:</strong> {@code g} (higher is better, i.e. closer to the goal).</li>
     * <li><strong>Tertiary:</strong> Cell index, for deterministic output.</li>
     * </ol>
     * </p>
     */
    @Override
    public int compareTo(CellState other) {
        int priorityCompare = Double.compare(this.priority, other.priority);
        if (priorityCompare != 0) {
            return priorityCompare;
        }
        int depthCompare = Integer.compare(other.gScore, this.gScore);
        if (depthCompare != 0) {
            return depthCompare;
        }
        return Integer.compare(this.cellIndex, other.cellIndex);
    }

    @Override
    public String toString() {
        return "CellState{" +
                "cell=" + cellIndex +
                ", g=" + gScore +
                ", f=" + priority +
                ", pred=" + predecessor +
                '}';
    }
}
