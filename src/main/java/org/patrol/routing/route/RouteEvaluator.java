package org.patrol.routing.route;

import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.ZoneId;
import org.patrol.routing.geo.GeoMetric;

import java.util.List;
import java.util.Objects;

/**
 * Replays stop sequences as closed walks from and back to the starting site.
 *
 * <p>Stateless apart from the immutable walking model, so one instance may be shared
 * by concurrent searches.</p>
 */
public final class RouteEvaluator {
    private final double dwellMinutes;
    private final double walkingSpeedKmh;

    /**
     * Creates an evaluator from the walking model of {@code constraints}.
     */
    public RouteEvaluator(RouteConstraints constraints) {
        this(constraints.getDwellMinutes(), constraints.getWalkingSpeedKmh());
    }

    /**
     * @param dwellMinutes fixed minutes spent at every visited site.
     * @param walkingSpeedKmh constant walking speed.
     */
    public RouteEvaluator(double dwellMinutes, double walkingSpeedKmh) {
        if (!(dwellMinutes >= 0.0d) || !Double.isFinite(dwellMinutes)) {
            throw new IllegalArgumentException("dwellMinutes must be finite and >= 0: " + dwellMinutes);
        }
        if (!(walkingSpeedKmh > 0.0d) || !Double.isFinite(walkingSpeedKmh)) {
            throw new IllegalArgumentException("walkingSpeedKmh must be finite and > 0: " + walkingSpeedKmh);
        }
        this.dwellMinutes = dwellMinutes;
        this.walkingSpeedKmh = walkingSpeedKmh;
    }

    /**
     * Computes totals for {@code start -> stops... -> start}.
     *
     * <p>Dwell applies to every visited site, never to the return leg. An empty
     * stop list yields {@link RouteMetrics#ZERO}.</p>
     */
    public RouteMetrics metrics(Site start, List<Site> stops) {
        Objects.requireNonNull(start, "start");
        if (stops.isEmpty()) {
            return RouteMetrics.ZERO;
        }

        double totalDistance = 0.0d;
        double totalTime = 0.0d;
        double totalValue = 0.0d;
        Site current = start;
        for (Site stop : stops) {
            double distance = GeoMetric.distanceKm(current, stop);
            totalDistance += distance;
            totalTime += GeoMetric.travelTimeMinutes(distance, walkingSpeedKmh) + dwellMinutes;
            totalValue += stop.reward();
            current = stop;
        }

        double returnDistance = GeoMetric.distanceKm(current, start);
        totalDistance += returnDistance;
        totalTime += GeoMetric.travelTimeMinutes(returnDistance, walkingSpeedKmh);
        return new RouteMetrics(totalDistance, totalTime, totalValue);
    }

    public RouteMetrics metrics(Route route) {
        return metrics(route.start(), route.stops());
    }

    /**
     * Checks stop count, zone membership, self-visits and the time budget, cheapest first.
     */
    public boolean isFeasible(Site start, List<Site> stops, double maxTimeMinutes, int maxStops) {
        if (stops.size() > maxStops) {
            return false;
        }
        ZoneId zone = start.zone();
        for (Site stop : stops) {
            if (!zone.equals(stop.zone()) || stop.id() == start.id()) {
                return false;
            }
        }
        return metrics(start, stops).timeMinutes() <= maxTimeMinutes;
    }

    public boolean isFeasible(Site start, List<Site> stops, RouteConstraints constraints) {
        return isFeasible(start, stops, constraints.getMaxTimeMinutes(), constraints.getMaxStops());
    }

    /**
     * Minutes to walk from {@code from} to {@code to} and then dwell there.
     */
    public double legCostMinutes(Site from, Site to) {
        return GeoMetric.travelTimeMinutes(GeoMetric.distanceKm(from, to), walkingSpeedKmh) + dwellMinutes;
    }
}
