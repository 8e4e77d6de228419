package org.wireroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-query bound on pathfinder work.
 *
 * <p>Expansions are unbounded by default; interactive hosts can cap them with the
 * {@code wireroute.routing.search.maxExpandedCells} system property. The grid size is always
 * capped, since the search allocates per-cell arrays: {@value #DEFAULT_MAX_GRID_CELLS} cells
 * unless {@code wireroute.routing.search.maxGridCells} says otherwise.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final long DEFAULT_MAX_GRID_CELLS = 4_000_000L;

    public static final String REASON_EXPANDED_EXCEEDED = "SEARCH_BUDGET_EXPANDED_EXCEEDED";
    public static final String REASON_GRID_TOO_LARGE = "SEARCH_BUDGET_GRID_TOO_LARGE";

    private static final String PROP_MAX_EXPANDED = "wireroute.routing.search.maxExpandedCells";
    private static final String PROP_MAX_GRID_CELLS = "wireroute.routing.search.maxGridCells";

    @Getter
    @Accessors(fluent = true)
    private final int maxExpandedCells;
    @Getter
    @Accessors(fluent = true)
    private final long maxGridCells;

    private SearchBudget(int maxExpandedCells, long maxGridCells) {
        this.maxExpandedCells = normalizeBound(maxExpandedCells);
        this.maxGridCells = maxGridCells > 0L ? Math.min(maxGridCells, Integer.MAX_VALUE) : DEFAULT_MAX_GRID_CELLS;
    }

    /**
     * Creates a budget with an explicit expansion bound; non-positive means unbounded.
     * The grid cap keeps its default.
     */
    public static SearchBudget of(int maxExpandedCells) {
        return new SearchBudget(maxExpandedCells, DEFAULT_MAX_GRID_CELLS);
    }

    /**
     * Creates a budget with explicit bounds. A non-positive grid cap means the default.
     */
    public static SearchBudget of(int maxExpandedCells, long maxGridCells) {
        return new SearchBudget(maxExpandedCells, maxGridCells);
    }

    /**
     * Unbounded expansions with the default grid cap.
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, DEFAULT_MAX_GRID_CELLS);
    }

    /**
     * Loads both bounds from system properties.
     */
    public static SearchBudget defaults() {
        return of(readBound(PROP_MAX_EXPANDED), readGridCap(PROP_MAX_GRID_CELLS));
    }

    /**
     * Returns whether a grid of {@code cellCount} cells may be built and searched.
     */
    public boolean allowsGridCells(long cellCount) {
        return cellCount <= maxGridCells;
    }

    /**
     * Validates the number of expanded cells against the bound.
     *
     * @throws BudgetExceededException when the bound is exceeded.
     */
    void checkExpandedCells(int expandedCells) {
        if (expandedCells > maxExpandedCells) {
            throw new BudgetExceededException(
                    REASON_EXPANDED_EXCEEDED,
                    "expanded-cell budget exceeded: " + expandedCells + " > " + maxExpandedCells,
                    expandedCells
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    private static long readGridCap(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_GRID_CELLS;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_GRID_CELLS;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;
        private final int expandedCells;

        BudgetExceededException(String reasonCode, String message, int expandedCells) {
            super(message);
            this.reasonCode = reasonCode;
            this.expandedCells = expandedCells;
        }
    }
}
