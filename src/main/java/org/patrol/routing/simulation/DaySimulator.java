package org.patrol.routing.simulation;

import lombok.extern.slf4j.Slf4j;
import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.ZoneId;
import org.patrol.routing.catalog.ZoneIndex;
import org.patrol.routing.route.Route;
import org.patrol.routing.route.RouteMetrics;
import org.patrol.routing.search.RouteOptimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Runs one optimization per starting site and packages the results.
 */
@Slf4j
public final class DaySimulator {
    private final RouteOptimizer optimizer;

    public DaySimulator(RouteOptimizer optimizer) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer");
    }

    /**
     * Simulates day 1 from {@code start} with a generator seeded from {@code seed}.
     */
    public DayResult simulateDay(Site start, String strategyId, long seed) {
        return simulateDay(1, start, strategyId, new SplittableRandom(seed));
    }

    /**
     * Simulates one day.
     *
     * @param day day number reported in the result.
     * @param start starting site.
     * @param strategyId registered strategy id.
     * @param random generator owned by this call.
     */
    public DayResult simulateDay(int day, Site start, String strategyId, SplittableRandom random) {
        Route route = optimizer.optimize(start, strategyId, random);
        RouteMetrics metrics = optimizer.metrics(route);
        log.info("Day {} [{}] zone {} start {}: {} stops, {} km, {} min, value {}",
                day,
                strategyId,
                start.zone(),
                start.id(),
                route.size(),
                format(metrics.distanceKm()),
                format(metrics.timeMinutes()),
                format(metrics.value()));
        return DayResult.builder()
                .day(day)
                .strategyId(strategyId)
                .route(route)
                .metrics(metrics)
                .zone(start.zone())
                .build();
    }

    /**
     * Simulates consecutive days, numbered from 1, one per starting site.
     *
     * <p>Each day draws its own generator split from a root seeded with {@code seed},
     * so a day's outcome depends only on the seed and its position.</p>
     */
    public List<DayResult> simulateDays(List<Site> starts, String strategyId, long seed) {
        Objects.requireNonNull(starts, "starts");
        SplittableRandom root = new SplittableRandom(seed);
        List<DayResult> results = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            results.add(simulateDay(i + 1, starts.get(i), strategyId, root.split()));
        }
        return results;
    }

    /**
     * Picks one starting site per day: a random zone, then a random site of that zone.
     */
    public List<Site> randomStartingPoints(int days, long seed) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0: " + days);
        }
        ZoneIndex zoneIndex = optimizer.zoneIndex();
        List<ZoneId> zones = new ArrayList<>(zoneIndex.zoneIds());
        if (days > 0 && zones.isEmpty()) {
            throw new IllegalStateException("catalog has no zones to start from");
        }
        SplittableRandom random = new SplittableRandom(seed);
        List<Site> starts = new ArrayList<>(days);
        for (int day = 0; day < days; day++) {
            ZoneId zone = zones.get(random.nextInt(zones.size()));
            List<Site> sites = zoneIndex.sitesIn(zone);
            starts.add(sites.get(random.nextInt(sites.size())));
        }
        return starts;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
