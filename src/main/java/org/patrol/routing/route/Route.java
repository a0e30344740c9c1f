package org.patrol.routing.route;

import lombok.Value;
import lombok.experimental.Accessors;
import org.patrol.routing.catalog.Site;

import java.util.List;
import java.util.Objects;

/**
 * Ordered stop sequence anchored at a starting site. The walk always returns
 * to {@code start} after the last stop.
 */
@Value
@Accessors(fluent = true)
public class Route {
    Site start;
    List<Site> stops;

    public Route(Site start, List<Site> stops) {
        this.start = Objects.requireNonNull(start, "start");
        this.stops = List.copyOf(Objects.requireNonNull(stops, "stops"));
    }

    public static Route empty(Site start) {
        return new Route(start, List.of());
    }

    public boolean isEmpty() {
        return stops.isEmpty();
    }

    public int size() {
        return stops.size();
    }
}
