package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Strategy contract for choosing and ordering the stops of one day.
 *
 * <p>Implementations must return a feasible stop list for {@code context.constraints()},
 * or an empty list when none is found. They keep no state between calls, and all
 * randomness comes from the supplied generator.</p>
 */
public interface RouteSearchStrategy {

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Searches stops for one starting site.
     *
     * @param context shared read-only inputs.
     * @param start starting site; the walk returns here.
     * @param random generator owned by this call.
     * @return ordered feasible stops, possibly empty.
     */
    List<Site> search(SearchContext context, Site start, SplittableRandom random);
}
