package org.wireroute.routing.core;

/**
 * Requested drawing style for a wire.
 *
 * <p>All styles currently produce orthogonal routes. {@code DIAGONAL} is accepted for
 * compatibility with diagram settings but is routed orthogonally.</p>
 */
public enum RoutingStyle {
    ORTHOGONAL,
    MANHATTAN,
    DIAGONAL
}
