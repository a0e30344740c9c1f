package org.patrol.routing.search;

import org.patrol.routing.catalog.Site;
import org.patrol.routing.route.RouteEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Greedy value-per-minute construction.
 *
 * <p>From the current position, each round appends the candidate with the highest
 * {@code reward / (walk minutes + dwell)} among those that keep the route feasible.
 * Equal scores go to the lowest site id. O(k^2) feasibility checks for a pool of k.</p>
 */
public final class GreedyRouteStrategy implements RouteSearchStrategy {

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_GREEDY;
    }

    @Override
    public List<Site> search(SearchContext context, Site start, SplittableRandom random) {
        List<Site> available = context.candidatePool(start);
        List<Site> selected = new ArrayList<>();
        RouteEvaluator evaluator = context.evaluator();
        Site current = start;

        while (selected.size() < context.maxStops() && !available.isEmpty()) {
            int bestIndex = -1;
            double bestScore = Double.NEGATIVE_INFINITY;

            for (int i = 0; i < available.size(); i++) {
                Site candidate = available.get(i);
                selected.add(candidate);
                boolean feasible = context.isFeasible(start, selected);
                selected.remove(selected.size() - 1);
                if (!feasible) {
                    continue;
                }

                double score = score(candidate, evaluator.legCostMinutes(current, candidate));
                if (score > bestScore) {
                    bestScore = score;
                    bestIndex = i;
                }
            }

            if (bestIndex < 0) {
                break;
            }
            Site best = available.remove(bestIndex);
            selected.add(best);
            current = best;
        }
        return selected;
    }

    /**
     * Value per minute; a zero-cost leg to a rewarding site scores +INF.
     */
    static double score(Site candidate, double legCostMinutes) {
        if (legCostMinutes <= 0.0d) {
            return candidate.reward() > 0.0d ? Double.POSITIVE_INFINITY : 0.0d;
        }
        return candidate.reward() / legCostMinutes;
    }
}
