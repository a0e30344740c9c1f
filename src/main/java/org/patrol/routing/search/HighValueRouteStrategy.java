package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Visits candidates in descending reward order, keeping each one whose addition
 * leaves the route feasible. Equal rewards go to the lowest id.
 */
public final class HighValueRouteStrategy implements RouteSearchStrategy {
    private static final Comparator<Site> BY_REWARD_DESC =
            Comparator.comparingDouble(Site::reward).reversed().thenComparingInt(Site::id);

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_HIGH_VALUE;
    }

    @Override
    public List<Site> search(SearchContext context, Site start, SplittableRandom random) {
        List<Site> pool = context.candidatePool(start);
        pool.sort(BY_REWARD_DESC);

        List<Site> selected = new ArrayList<>();
        for (Site candidate : pool) {
            if (selected.size() >= context.maxStops()) {
                break;
            }
            selected.add(candidate);
            if (!context.isFeasible(start, selected)) {
                selected.remove(selected.size() - 1);
            }
        }
        return selected;
    }
}
