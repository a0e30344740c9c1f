package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.ZoneIndex;
import org.patrol.routing.route.RouteConstraints;
import org.patrol.routing.route.RouteEvaluator;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Read-only inputs shared by every strategy invocation.
 */
public record SearchContext(ZoneIndex zoneIndex, RouteEvaluator evaluator, RouteConstraints constraints) {
    private static final Comparator<Site> BY_ID = Comparator.comparingInt(Site::id);

    public SearchContext {
        Objects.requireNonNull(zoneIndex, "zoneIndex");
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(constraints, "constraints");
    }

    /**
     * Same-zone candidates for {@code start}, excluding itself, ordered by ascending id.
     *
     * <p>Ascending id order is the tie-break order for every strategy.</p>
     */
    public List<Site> candidatePool(Site start) {
        List<Site> pool = zoneIndex.candidatesFor(start.zone(), start.id());
        pool.sort(BY_ID);
        return pool;
    }

    public boolean isFeasible(Site start, List<Site> stops) {
        return evaluator.isFeasible(start, stops, constraints);
    }

    public int maxStops() {
        return constraints.getMaxStops();
    }

    /**
     * Sum of rewards; equals {@code metrics(start, stops).value()} without walking the legs.
     */
    public static double totalValue(List<Site> stops) {
        double value = 0.0d;
        for (Site stop : stops) {
            value += stop.reward();
        }
        return value;
    }
}
