package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Baseline that returns the first feasible random sample, or nothing after
 * {@link #MAX_ATTEMPTS} tries.
 */
public final class RandomRouteStrategy implements RouteSearchStrategy {
    public static final int MAX_ATTEMPTS = 100;

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_RANDOM;
    }

    @Override
    public List<Site> search(SearchContext context, Site start, SplittableRandom random) {
        List<Site> pool = context.candidatePool(start);
        int maxSampleSize = Math.min(context.maxStops(), pool.size());
        if (maxSampleSize < 1) {
            return new ArrayList<>();
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            int size = random.nextInt(1, maxSampleSize + 1);
            List<Site> sample = GeneticOperators.sample(pool, size, random);
            if (context.isFeasible(start, sample)) {
                return sample;
            }
        }
        return new ArrayList<>();
    }
}
