package org.patrol.app;

import lombok.extern.slf4j.Slf4j;
import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.SiteCatalog;
import org.patrol.routing.catalog.ZoneBoundary;
import org.patrol.routing.catalog.ZoneBoundaryIndex;
import org.patrol.routing.catalog.ZoneId;
import org.patrol.routing.route.RouteConstraints;
import org.patrol.routing.search.PopulationSearchConfig;
import org.patrol.routing.search.RouteOptimizer;
import org.patrol.routing.search.RouteStrategyRegistry;
import org.patrol.routing.simulation.DayResult;
import org.patrol.routing.simulation.DaySimulator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Smoke run over a synthetic six-zone catalog: five days per built-in strategy.
 */
@Slf4j
public class Main {
    static final int DAYS = 5;
    static final int SITES_PER_ZONE = 15;
    static final long DEFAULT_SEED = 42L;

    private static final String[] CATEGORIES = {"bar", "restaurant", "cinema", "theatre", "club"};
    private static final double LAT_MIN = 41.8128d;
    private static final double LAT_STEP = 0.0358d;
    private static final double LON_MIN = 12.43652d;
    private static final double LON_STEP = 0.04859d;

    /**
     * Launches the smoke run.
     *
     * @param args optional seed as the first argument.
     */
    public static void main(String[] args) {
        long seed = args.length > 0 ? Long.parseLong(args[0]) : DEFAULT_SEED;
        run(seed);
    }

    /**
     * Simulates {@link #DAYS} days with every built-in strategy from shared starting points.
     *
     * @return results keyed by strategy id, in run order.
     */
    static Map<String, List<DayResult>> run(long seed) {
        ZoneBoundaryIndex boundaries = syntheticBoundaries();
        SiteCatalog catalog = syntheticCatalog(boundaries, seed);
        RouteOptimizer optimizer = RouteOptimizer.builder()
                .catalog(catalog)
                .constraints(RouteConstraints.defaults())
                .populationConfig(PopulationSearchConfig.defaults())
                .build();
        DaySimulator simulator = new DaySimulator(optimizer);
        log.info("Catalog loaded: {} sites in {} zones", catalog.size(), catalog.zoneIndex().zoneCount());

        List<Site> starts = simulator.randomStartingPoints(DAYS, seed);
        Map<String, List<DayResult>> results = new LinkedHashMap<>();
        for (String strategyId : List.of(
                RouteStrategyRegistry.STRATEGY_GREEDY,
                RouteStrategyRegistry.STRATEGY_EXHAUSTIVE,
                RouteStrategyRegistry.STRATEGY_POPULATION,
                RouteStrategyRegistry.STRATEGY_HIGH_VALUE,
                RouteStrategyRegistry.STRATEGY_RANDOM
        )) {
            List<DayResult> days = simulator.simulateDays(starts, strategyId, seed);
            double total = 0.0d;
            for (DayResult day : days) {
                total += day.metrics().value();
            }
            log.info("Strategy {} collected {} over {} days", strategyId, String.format(Locale.ROOT, "%.2f", total), days.size());
            results.put(strategyId, days);
        }
        return results;
    }

    /**
     * Two columns by three rows of equal boxes, zones Z1..Z6.
     */
    static ZoneBoundaryIndex syntheticBoundaries() {
        List<ZoneBoundary> boundaries = new ArrayList<>();
        int zone = 1;
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 2; col++) {
                boundaries.add(ZoneBoundary.builder()
                        .zone(ZoneId.of("Z" + zone++))
                        .latMin(LAT_MIN + row * LAT_STEP)
                        .latMax(LAT_MIN + (row + 1) * LAT_STEP)
                        .lonMin(LON_MIN + col * LON_STEP)
                        .lonMax(LON_MIN + (col + 1) * LON_STEP)
                        .build());
            }
        }
        return new ZoneBoundaryIndex(boundaries);
    }

    static SiteCatalog syntheticCatalog(ZoneBoundaryIndex boundaries, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        List<Site> sites = new ArrayList<>();
        int id = 1;
        for (ZoneBoundary boundary : boundaries.boundaries()) {
            for (int i = 0; i < SITES_PER_ZONE; i++) {
                double lat = boundary.latMin() + random.nextDouble() * (boundary.latMax() - boundary.latMin());
                double lon = boundary.lonMin() + random.nextDouble() * (boundary.lonMax() - boundary.lonMin());
                sites.add(Site.builder()
                        .id(id++)
                        .latitude(lat)
                        .longitude(lon)
                        .category(CATEGORIES[random.nextInt(CATEGORIES.length)])
                        .reward(Math.round(random.nextDouble(50.0d, 500.0d) * 100.0d) / 100.0d)
                        .zone(boundary.zone())
                        .build());
            }
        }
        return SiteCatalog.of(sites);
    }
}
