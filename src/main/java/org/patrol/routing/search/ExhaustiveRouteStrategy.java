package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;
import org.patrol.routing.route.RouteConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Exact subset enumeration for small candidate pools.
 *
 * <p>Visits every combination of size {@code 1..min(maxStops, k)} in lexicographic
 * index order over the id-sorted pool and keeps the first one with strictly greater
 * value that is feasible. Stops are returned in pool (ascending id) order.</p>
 */
public final class ExhaustiveRouteStrategy implements RouteSearchStrategy {
    public static final String REASON_POOL_TOO_LARGE = "CONFIG_ENUMERATION_POOL_TOO_LARGE";

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_EXHAUSTIVE;
    }

    /**
     * @throws RouteConfigurationException when the pool exceeds
     *         {@code constraints.maxEnumerationPoolSize}.
     */
    @Override
    public List<Site> search(SearchContext context, Site start, SplittableRandom random) {
        List<Site> pool = context.candidatePool(start);
        int limit = context.constraints().getMaxEnumerationPoolSize();
        if (pool.size() > limit) {
            throw new RouteConfigurationException(
                    REASON_POOL_TOO_LARGE,
                    "candidate pool of zone " + start.zone() + " has " + pool.size()
                            + " sites, enumeration limit is " + limit
            );
        }
        return enumerate(context, start, pool);
    }

    /**
     * Enumerates {@code pool} without the size guard.
     */
    List<Site> enumerate(SearchContext context, Site start, List<Site> pool) {
        int n = pool.size();
        int maxSize = Math.min(context.maxStops(), n);
        List<Site> best = List.of();
        double bestValue = 0.0d;
        List<Site> trial = new ArrayList<>(maxSize);

        for (int size = 1; size <= maxSize; size++) {
            int[] indices = new int[size];
            for (int i = 0; i < size; i++) {
                indices[i] = i;
            }
            do {
                double value = 0.0d;
                for (int index : indices) {
                    value += pool.get(index).reward();
                }
                // Only strictly better subsets can replace the incumbent.
                if (value > bestValue) {
                    trial.clear();
                    for (int index : indices) {
                        trial.add(pool.get(index));
                    }
                    if (context.isFeasible(start, trial)) {
                        bestValue = value;
                        best = List.copyOf(trial);
                    }
                }
            } while (nextCombination(indices, n));
        }
        return new ArrayList<>(best);
    }

    /**
     * Advances {@code indices} to the next k-combination of {@code [0, n)} in lexicographic order.
     *
     * @return false when {@code indices} already held the last combination.
     */
    static boolean nextCombination(int[] indices, int n) {
        int k = indices.length;
        int i = k - 1;
        while (i >= 0 && indices[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        indices[i]++;
        for (int j = i + 1; j < k; j++) {
            indices[j] = indices[j - 1] + 1;
        }
        return true;
    }
}
