package org.patrol.routing.search;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.patrol.routing.catalog.Site;
import org.patrol.routing.catalog.SiteCatalog;
import org.patrol.routing.catalog.SiteCatalogException;
import org.patrol.routing.catalog.ZoneIndex;
import org.patrol.routing.route.Route;
import org.patrol.routing.route.RouteConfigurationException;
import org.patrol.routing.route.RouteConstraints;
import org.patrol.routing.route.RouteEvaluator;
import org.patrol.routing.route.RouteMetrics;

import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Route optimization entry point.
 *
 * <p>The facade owns the catalog, constraints and strategy registry, and validates
 * every input before any search starts. Execution flow:</p>
 * <ul>
 * <li>Validate constraints and population parameters once at construction.</li>
 * <li>Validate the starting site and resolve the strategy id per call.</li>
 * <li>Run the strategy with a caller-owned generator and check its output is feasible.</li>
 * </ul>
 *
 * <p>Immutable after construction; concurrent calls with distinct generators are safe.</p>
 */
@Slf4j
public final class RouteOptimizer {
    public static final String REASON_UNKNOWN_STRATEGY = "CONFIG_UNKNOWN_STRATEGY";

    private final SiteCatalog catalog;
    private final RouteConstraints constraints;
    private final RouteEvaluator evaluator;
    private final RouteStrategyRegistry registry;
    private final SearchContext context;

    /**
     * @param catalog validated site catalog.
     * @param constraints route limits; {@link RouteConstraints#defaults()} when null.
     * @param populationConfig population parameters used when {@code registry} is null.
     * @param registry optional strategy registry override.
     * @throws RouteConfigurationException when constraints or parameters are invalid.
     */
    @Builder
    public RouteOptimizer(
            SiteCatalog catalog,
            RouteConstraints constraints,
            PopulationSearchConfig populationConfig,
            RouteStrategyRegistry registry
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.constraints = (constraints == null ? RouteConstraints.defaults() : constraints).validate();
        PopulationSearchConfig population = populationConfig == null
                ? PopulationSearchConfig.defaults()
                : populationConfig;
        this.registry = registry == null ? new RouteStrategyRegistry(population.validate()) : registry;
        this.evaluator = new RouteEvaluator(this.constraints);
        this.context = new SearchContext(catalog.zoneIndex(), evaluator, this.constraints);
    }

    /**
     * Optimizes one day with a generator seeded from {@code seed}.
     */
    public Route optimize(Site start, String strategyId, long seed) {
        return optimize(start, strategyId, new SplittableRandom(seed));
    }

    /**
     * Optimizes one day.
     *
     * @param start starting site; need not belong to the catalog, but must not reuse
     *        the id of a different catalog site.
     * @param strategyId registered strategy id.
     * @param random generator owned by this call.
     * @return feasible route, empty when nothing fits.
     * @throws RouteConfigurationException when the strategy id is unknown.
     * @throws SiteCatalogException when the start is malformed or shadows a catalog site.
     */
    public Route optimize(Site start, String strategyId, SplittableRandom random) {
        catalog.validateStart(start);
        Objects.requireNonNull(random, "random");
        RouteSearchStrategy strategy = registry.strategy(strategyId);
        if (strategy == null) {
            throw new RouteConfigurationException(
                    REASON_UNKNOWN_STRATEGY,
                    "unknown strategy '" + strategyId + "', registered: " + registry.strategyIds()
            );
        }

        List<Site> stops = strategy.search(context, start, random);
        if (!evaluator.isFeasible(start, stops, constraints)) {
            throw new IllegalStateException("strategy " + strategy.id() + " returned an infeasible route for start " + start.id());
        }
        log.debug("Strategy {} chose {} stops for start {}", strategy.id(), stops.size(), start.id());
        return new Route(start, stops);
    }

    public RouteMetrics metrics(Route route) {
        return evaluator.metrics(route);
    }

    public boolean isFeasible(Route route) {
        return evaluator.isFeasible(route.start(), route.stops(), constraints);
    }

    public ZoneIndex zoneIndex() {
        return catalog.zoneIndex();
    }

    public RouteConstraints constraints() {
        return constraints;
    }

    public RouteEvaluator evaluator() {
        return evaluator;
    }

    public RouteStrategyRegistry registry() {
        return registry;
    }
}
