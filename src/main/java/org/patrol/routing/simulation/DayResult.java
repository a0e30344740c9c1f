package org.patrol.routing.simulation;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.ZoneId;
import org.patrol.routing.route.Route;
import org.patrol.routing.route.RouteMetrics;

import java.util.List;

/**
 * Outcome of one simulated day.
 *
 * <p>An empty route with zero metrics is a legitimate outcome, not a failure.</p>
 */
@Value
@Builder
@Accessors(fluent = true)
public class DayResult {
    /** Day number, starting at 1. */
    int day;
    /** Strategy that produced the route. */
    String strategyId;
    /** Chosen route, anchored at the starting site. */
    Route route;
    /** Totals of {@link #route}. */
    RouteMetrics metrics;
    /** Zone of the starting site, repeated for reporting. */
    ZoneId zone;

    public Site start() {
        return route.start();
    }

    public List<Site> stops() {
        return route.stops();
    }
}
