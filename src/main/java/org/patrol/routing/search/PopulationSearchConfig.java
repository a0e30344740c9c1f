package org.patrol.routing.search;

import lombok.Builder;
import lombok.Value;
import org.patrol.routing.route.RouteConfigurationException;

/**
 * Parameters of the population-based search.
 */
@Value
@Builder(toBuilder = true)
public class PopulationSearchConfig {
    public static final String REASON_POPULATION_SIZE_NOT_POSITIVE = "CONFIG_POPULATION_SIZE_NOT_POSITIVE";
    public static final String REASON_GENERATIONS_NEGATIVE = "CONFIG_GENERATIONS_NEGATIVE";
    public static final String REASON_MUTATION_RATE_OUT_OF_RANGE = "CONFIG_MUTATION_RATE_OUT_OF_RANGE";
    public static final String REASON_ELITE_FRACTION_OUT_OF_RANGE = "CONFIG_ELITE_FRACTION_OUT_OF_RANGE";

    public static final int DEFAULT_POPULATION_SIZE = 50;
    public static final int DEFAULT_GENERATIONS = 100;
    public static final double DEFAULT_MUTATION_RATE = 0.1d;
    public static final double DEFAULT_ELITE_FRACTION = 0.25d;

    private static final String PROP_POPULATION_SIZE = "patrol.search.populationSize";
    private static final String PROP_GENERATIONS = "patrol.search.generations";
    private static final String PROP_MUTATION_RATE = "patrol.search.mutationRate";
    private static final String PROP_ELITE_FRACTION = "patrol.search.eliteFraction";

    /**
     * Population cap. The effective size is {@code min(populationSize, 2 * poolSize)}.
     */
    @Builder.Default
    int populationSize = DEFAULT_POPULATION_SIZE;

    /** Fixed number of generations; bounds running time. */
    @Builder.Default
    int generations = DEFAULT_GENERATIONS;

    /** Probability that a crossover child is mutated. */
    @Builder.Default
    double mutationRate = DEFAULT_MUTATION_RATE;

    /** Share of the population carried over unchanged; at least one member. */
    @Builder.Default
    double eliteFraction = DEFAULT_ELITE_FRACTION;

    /**
     * Loads parameters from system properties, falling back to compiled defaults.
     */
    public static PopulationSearchConfig defaults() {
        return PopulationSearchConfig.builder()
                .populationSize(readInt(PROP_POPULATION_SIZE, DEFAULT_POPULATION_SIZE))
                .generations(readInt(PROP_GENERATIONS, DEFAULT_GENERATIONS))
                .mutationRate(readDouble(PROP_MUTATION_RATE, DEFAULT_MUTATION_RATE))
                .eliteFraction(readDouble(PROP_ELITE_FRACTION, DEFAULT_ELITE_FRACTION))
                .build();
    }

    /**
     * @return this instance for chaining.
     * @throws RouteConfigurationException on the first invalid field.
     */
    public PopulationSearchConfig validate() {
        if (populationSize <= 0) {
            throw new RouteConfigurationException(
                    REASON_POPULATION_SIZE_NOT_POSITIVE,
                    "populationSize must be > 0: " + populationSize
            );
        }
        if (generations < 0) {
            throw new RouteConfigurationException(REASON_GENERATIONS_NEGATIVE, "generations must be >= 0: " + generations);
        }
        if (!(mutationRate >= 0.0d && mutationRate <= 1.0d)) {
            throw new RouteConfigurationException(
                    REASON_MUTATION_RATE_OUT_OF_RANGE,
                    "mutationRate must be in [0, 1]: " + mutationRate
            );
        }
        if (!(eliteFraction > 0.0d && eliteFraction <= 1.0d)) {
            throw new RouteConfigurationException(
                    REASON_ELITE_FRACTION_OUT_OF_RANGE,
                    "eliteFraction must be in (0, 1]: " + eliteFraction
            );
        }
        return this;
    }

    /**
     * Elite count for a population of {@code effectivePopulationSize}.
     */
    public int eliteSize(int effectivePopulationSize) {
        return Math.max(1, (int) Math.floor(effectivePopulationSize * eliteFraction));
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
