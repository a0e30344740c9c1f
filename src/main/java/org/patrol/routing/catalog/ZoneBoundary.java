package org.patrol.routing.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Axis-aligned latitude/longitude box owned by one zone. Bounds are inclusive.
 */
@Value
@Builder
@Accessors(fluent = true)
public class ZoneBoundary {
    ZoneId zone;
    double latMin;
    double latMax;
    double lonMin;
    double lonMax;

    /**
     * Returns true when the coordinate lies inside or on the edge of the box.
     */
    public boolean contains(double latitude, double longitude) {
        return latMin <= latitude && latitude <= latMax
                && lonMin <= longitude && longitude <= lonMax;
    }
}
