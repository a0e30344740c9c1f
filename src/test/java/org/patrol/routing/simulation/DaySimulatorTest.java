package org.patrol.routing.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.patrol.routing.catalog.Site;
import org.patrol.routing.route.RouteConstraints;
import org.patrol.routing.route.RouteEvaluator;
import org.patrol.routing.route.RouteMetrics;
import org.patrol.routing.search.PopulationSearchConfig;
import org.patrol.routing.search.RouteOptimizer;
import org.patrol.routing.search.RouteStrategyRegistry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.patrol.routing.testutil.SiteFixtures.A;
import static org.patrol.routing.testutil.SiteFixtures.START;
import static org.patrol.routing.testutil.SiteFixtures.Z1;
import static org.patrol.routing.testutil.SiteFixtures.scenarioCatalog;

@DisplayName("DaySimulator Tests")
class DaySimulatorTest {

    private static DaySimulator simulator(RouteConstraints constraints) {
        return new DaySimulator(RouteOptimizer.builder()
                .catalog(scenarioCatalog())
                .constraints(constraints)
                .populationConfig(PopulationSearchConfig.builder().generations(10).build())
                .build());
    }

    @Test
    @DisplayName("Day result carries the evaluated metrics and the start zone")
    void testSimulateDay() {
        DaySimulator simulator = simulator(RouteConstraints.builder().maxStops(2).build());

        DayResult result = simulator.simulateDay(START, RouteStrategyRegistry.STRATEGY_EXHAUSTIVE, 5L);
        RouteMetrics expected = new RouteEvaluator(RouteConstraints.builder().build())
                .metrics(result.route());

        assertEquals(1, result.day());
        assertEquals(RouteStrategyRegistry.STRATEGY_EXHAUSTIVE, result.strategyId());
        assertEquals(Z1, result.zone());
        assertSame(START, result.start());
        assertEquals(expected, result.metrics());
        assertEquals(30.0, result.metrics().value(), 1e-12);
    }

    @Test
    @DisplayName("Nothing fits: empty day with zero metrics")
    void testEmptyDay() {
        DaySimulator simulator = simulator(RouteConstraints.builder().maxTimeMinutes(1.0).build());

        DayResult result = simulator.simulateDay(START, RouteStrategyRegistry.STRATEGY_GREEDY, 5L);

        assertTrue(result.stops().isEmpty());
        assertEquals(RouteMetrics.ZERO, result.metrics());
    }

    @Test
    @DisplayName("Multi-day runs are numbered from one and reproducible")
    void testSimulateDays() {
        DaySimulator simulator = simulator(RouteConstraints.builder().maxStops(2).build());
        List<Site> starts = List.of(START, A, START);

        List<DayResult> first = simulator.simulateDays(starts, RouteStrategyRegistry.STRATEGY_RANDOM, 17L);
        List<DayResult> second = simulator.simulateDays(starts, RouteStrategyRegistry.STRATEGY_RANDOM, 17L);

        assertEquals(3, first.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(i + 1, first.get(i).day());
            assertSame(starts.get(i), first.get(i).start());
            assertEquals(first.get(i), second.get(i));
        }
        assertTrue(first.get(1).stops().stream().noneMatch(s -> s.id() == A.id()));
    }

    @Test
    @DisplayName("Random starting points are catalog sites and reproducible")
    void testRandomStartingPoints() {
        DaySimulator simulator = simulator(RouteConstraints.builder().build());

        List<Site> starts = simulator.randomStartingPoints(6, 3L);

        assertEquals(6, starts.size());
        assertEquals(starts, simulator.randomStartingPoints(6, 3L));
        assertTrue(scenarioCatalog().sites().containsAll(starts));
        assertTrue(simulator.randomStartingPoints(0, 3L).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> simulator.randomStartingPoints(-1, 3L));
    }
}
