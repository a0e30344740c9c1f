package org.patrol.routing.route;

/**
 * Derived route totals: kilometres walked, minutes elapsed, value collected.
 */
public record RouteMetrics(double distanceKm, double timeMinutes, double value) {
    public static final RouteMetrics ZERO = new RouteMetrics(0.0d, 0.0d, 0.0d);
}
