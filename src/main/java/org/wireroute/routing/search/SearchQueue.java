package org.wireroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A min-priority queue specialized for grid A*.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Pooled States:</strong> Extracted {@link CellState} instances are returned through
 * {@link #recycle(CellState)} and reused, so the search allocates at most one state per
 * simultaneously queued cell.</li>
 * <li><strong>Decrease-Key Support:</strong> O(log n) priority improvement for a cell that is
 * already queued, via a position tracking array indexed by cell.</li>
 * <li><strong>Strict Contracts:</strong> Capacity and recycle accounting are enforced to detect
 * leaks (forgotten recycles) early.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class SearchQueue {
    private static final Logger log = LoggerFactory.getLogger(SearchQueue.class);

    // Binary heap, 1-based indexing
    private final CellState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[cellIndex] = heapIndex, 0 when absent
    private final int[] positions;

    // Stack of recycled states; grown lazily up to capacity
    private final CellState[] pool;
    private int poolTop = -1;
    private int allocated = 0;

    private int activeStates = 0;
    @Getter
    private int peakActiveStates = 0;

    /**
     * Initializes the queue with fixed capacity.
     *
     * @param cellCount number of cells in the grid; valid indices are {@code [0, cellCount)}.
     * @param capacity maximum number of states the queue can hold simultaneously.
     * @throws IllegalArgumentException if either bound is not positive.
     */
    public SearchQueue(int cellCount, int capacity) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = new CellState[capacity + 1];
        this.positions = new int[cellCount];
        this.pool = new CellState[capacity];
    }

    /**
     * Inserts a cell or improves it if it is already queued with a larger {@code g}.
     *
     * @param cellIndex   cell to queue.
     * @param gScore      steps from the start cell.
     * @param priority    {@code g + h}.
     * @param predecessor cell this one is reached from.
     * @throws IllegalArgumentException if cellIndex is out of bounds.
     * @throws IllegalStateException    if the heap is full.
     */
    public void insert(int cellIndex, int gScore, double priority, int predecessor) {
        if (cellIndex < 0 || cellIndex >= positions.length) {
            throw new IllegalArgumentException("cellIndex " + cellIndex + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[cellIndex];
        if (existingIdx > 0 && existingIdx <= size) {
            CellState existing = heap[existingIdx];
            if (gScore < existing.gScore) {
                existing.set(cellIndex, gScore, priority, predecessor);
                swim(existingIdx);
            }
            return;
        }

        if (size >= heap.length - 1) {
            throw new IllegalStateException("Heap full. Increase capacity.");
        }

        CellState newState = acquire();
        newState.set(cellIndex, gScore, priority, predecessor);

        size++;
        heap[size] = newState;
        positions[cellIndex] = size;
        swim(size);
    }

    /**
     * Extracts the state with the minimum priority.
     * <p>
     * <strong>Contract:</strong> The caller MUST hand the state back via
     * {@link #recycle(CellState)} once it has read it.
     * </p>
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public CellState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        CellState min = heap[1];
        int lastIndex = size;

        if (lastIndex == 1) {
            heap[1] = null;
            positions[min.cellIndex] = 0;
            size = 0;
            return min;
        }

        CellState last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;

        positions[last.cellIndex] = 1;
        positions[min.cellIndex] = 0;

        sink(1);
        return min;
    }

    /**
     * Returns a state to the pool for reuse.
     *
     * @param state the state to recycle. If null, method does nothing.
     * @throws IllegalStateException if more states are recycled than were handed out.
     */
    public void recycle(CellState state) {
        if (state == null) return;

        if (activeStates <= 0) {
            throw new IllegalStateException("Recycle called with no active states");
        }
        if (poolTop >= pool.length - 1) {
            throw new IllegalStateException("Pool overflow or double-recycle detected");
        }

        activeStates--;
        pool[++poolTop] = state;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns whether a cell is currently queued.
     */
    public boolean contains(int cellIndex) {
        int idx = positions[cellIndex];
        return idx > 0 && idx <= size && heap[idx].cellIndex == cellIndex;
    }

    /**
     * Clears the queue and returns all queued states to the pool.
     * <p>
     * States that were extracted but never recycled are reported and written off so the
     * queue keeps its full capacity for the next search.
     * </p>
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            CellState s = heap[i];
            if (s != null) {
                if (positions[s.cellIndex] == i) {
                    positions[s.cellIndex] = 0;
                }
                recycle(s);
                heap[i] = null;
            }
        }
        size = 0;

        if (activeStates != 0) {
            log.warn("{} cell states leaked (extracted but not recycled); writing them off", activeStates);
            allocated -= activeStates;
            activeStates = 0;
        }
    }

    /**
     * Diagnostic: share of capacity currently checked out (0.0 to 1.0).
     */
    public double getPoolUtilization() {
        return (double) activeStates / pool.length;
    }

    private CellState acquire() {
        CellState state;
        if (poolTop >= 0) {
            state = pool[poolTop];
            pool[poolTop--] = null;
        } else if (allocated < pool.length) {
            state = new CellState();
            allocated++;
        } else {
            throw new IllegalStateException(
                    "Pool exhausted. Call clear() or recycle extracted states. " +
                            "Active: " + activeStates + ", Capacity: " + pool.length
            );
        }
        activeStates++;
        if (activeStates > peakActiveStates) {
            peakActiveStates = activeStates;
        }
        return state;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        CellState s1 = heap[i];
        CellState s2 = heap[j];

        heap[i] = s2;
        heap[j] = s1;

        positions[s1.cellIndex] = j;
        positions[s2.cellIndex] = i;
    }
}
