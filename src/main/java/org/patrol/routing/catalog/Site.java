package org.patrol.routing.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.patrol.routing.geo.GeoPoint;

/**
 * Immutable reward-bearing site.
 *
 * <p>Construction does not validate; {@link SiteCatalog} rejects malformed records
 * before they reach any search.</p>
 */
@Value
@Builder
@Accessors(fluent = true)
public class Site implements GeoPoint {
    /** Unique id within the catalog. */
    int id;
    /** Latitude in degrees. */
    double latitude;
    /** Longitude in degrees. */
    double longitude;
    /** Free-form category label (for example "bar" or "restaurant"). */
    String category;
    /** Non-negative value collected when the site is visited. */
    double reward;
    /** Zone the site belongs to. */
    ZoneId zone;
}
