package org.patrol.routing.search;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of route search strategies keyed by id.
 */
public final class RouteStrategyRegistry {
    public static final String STRATEGY_GREEDY = "GREEDY";
    public static final String STRATEGY_EXHAUSTIVE = "EXHAUSTIVE";
    public static final String STRATEGY_POPULATION = "POPULATION";
    public static final String STRATEGY_RANDOM = "RANDOM";
    public static final String STRATEGY_HIGH_VALUE = "HIGH_VALUE";

    private final Map<String, RouteSearchStrategy> strategiesById;

    /**
     * Creates a registry with built-in strategies, the population search reading
     * {@link PopulationSearchConfig#defaults()}.
     */
    public RouteStrategyRegistry() {
        this(PopulationSearchConfig.defaults());
    }

    /**
     * Creates a registry with built-in strategies and an explicit population configuration.
     */
    public RouteStrategyRegistry(PopulationSearchConfig populationConfig) {
        this.strategiesById = Map.copyOf(materialize(builtIns(populationConfig)));
    }

    /**
     * Creates a registry by merging built-ins with custom strategies; custom ids win.
     */
    public RouteStrategyRegistry(PopulationSearchConfig populationConfig, Collection<? extends RouteSearchStrategy> customStrategies) {
        LinkedHashMap<String, RouteSearchStrategy> merged = materialize(builtIns(populationConfig));
        if (customStrategies != null) {
            merged.putAll(materialize(customStrategies));
        }
        this.strategiesById = Map.copyOf(merged);
    }

    /**
     * Returns strategy by id, or null when not registered.
     */
    public RouteSearchStrategy strategy(String strategyId) {
        if (strategyId == null) {
            return null;
        }
        return strategiesById.get(strategyId.trim());
    }

    /**
     * Returns immutable set of registered strategy ids.
     */
    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    private static List<RouteSearchStrategy> builtIns(PopulationSearchConfig populationConfig) {
        Objects.requireNonNull(populationConfig, "populationConfig");
        return List.of(
                new GreedyRouteStrategy(),
                new ExhaustiveRouteStrategy(),
                new PopulationRouteStrategy(populationConfig),
                new RandomRouteStrategy(),
                new HighValueRouteStrategy()
        );
    }

    private static LinkedHashMap<String, RouteSearchStrategy> materialize(
            Collection<? extends RouteSearchStrategy> strategies
    ) {
        LinkedHashMap<String, RouteSearchStrategy> map = new LinkedHashMap<>();
        for (RouteSearchStrategy strategy : strategies) {
            RouteSearchStrategy nonNullStrategy = Objects.requireNonNull(strategy, "strategy");
            map.put(normalizeRequiredId(nonNullStrategy.id(), "strategy.id"), nonNullStrategy);
        }
        return map;
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }
}
