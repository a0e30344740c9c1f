package org.patrol.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.patrol.routing.catalog.Site;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.patrol.routing.testutil.SiteFixtures.A;
import static org.patrol.routing.testutil.SiteFixtures.B;
import static org.patrol.routing.testutil.SiteFixtures.D;
import static org.patrol.routing.testutil.SiteFixtures.START;
import static org.patrol.routing.testutil.SiteFixtures.context;
import static org.patrol.routing.testutil.SiteFixtures.scatteredCatalog;
import static org.patrol.routing.testutil.SiteFixtures.scenarioCatalog;

@DisplayName("Random and high-value baseline Tests")
class BaselineRouteStrategiesTest {

    @Test
    @DisplayName("High-value: richest sites first, bounded by the stop limit")
    void testHighValueOrder() {
        SearchContext context = context(scenarioCatalog(), 3, 180.0);

        List<Site> route = new HighValueRouteStrategy().search(context, START, new SplittableRandom(0));

        assertEquals(List.of(B, A, D), route);
    }

    @Test
    @DisplayName("High-value: skips a site that breaks the budget and keeps going")
    void testHighValueSkipsInfeasible() {
        SearchContext context = context(scatteredCatalog(25, 4L), 8, 45.0);

        List<Site> route = new HighValueRouteStrategy().search(context, START, new SplittableRandom(0));

        assertTrue(context.isFeasible(START, route));
        for (int i = 1; i < route.size(); i++) {
            assertTrue(route.get(i - 1).reward() >= route.get(i).reward());
        }
    }

    @Test
    @DisplayName("Random: first feasible sample, deterministic for a seed")
    void testRandomDeterministic() {
        SearchContext context = context(scatteredCatalog(15, 2L), 4, 60.0);
        RandomRouteStrategy strategy = new RandomRouteStrategy();

        List<Site> first = strategy.search(context, START, new SplittableRandom(21));
        List<Site> second = strategy.search(context, START, new SplittableRandom(21));

        assertEquals(first, second);
        assertTrue(context.isFeasible(START, first));
    }

    @Test
    @DisplayName("Random: empty after exhausting attempts")
    void testRandomGivesUp() {
        SearchContext context = context(scenarioCatalog(), 4, 1.0);

        assertTrue(new RandomRouteStrategy().search(context, START, new SplittableRandom(21)).isEmpty());
        assertTrue(new RandomRouteStrategy().search(context(scenarioCatalog(), 0, 180.0), START,
                new SplittableRandom(21)).isEmpty());
    }
}
