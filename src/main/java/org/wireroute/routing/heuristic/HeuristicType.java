package org.wireroute.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables heuristic guidance (uniform-cost search).</p>
 * <p>{@code MANHATTAN} uses cell-space {@code |dx| + |dy|}, admissible and consistent on a
 * 4-connected unit-cost grid.</p>
 */
public enum HeuristicType {
    NONE,
    MANHATTAN
}
