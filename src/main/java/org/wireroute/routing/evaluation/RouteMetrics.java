package org.wireroute.routing.evaluation;

/**
 * Aggregate figures for one finished route.
 *
 * @param totalLength sum of segment lengths.
 * @param bendCount {@code max(0, segments - 1)}.
 * @param quality advisory score in {@code [0, 1]}.
 */
public record RouteMetrics(double totalLength, int bendCount, double quality) {
}
