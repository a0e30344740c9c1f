package org.patrol.routing.search;

import lombok.extern.slf4j.Slf4j;
import org.patrol.routing.catalog.Site;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Elitist population search over stop subsets.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Pools no larger than {@code maxStops} are solved exactly by {@link ExhaustiveRouteStrategy}.</li>
 * <li>{@code min(populationSize, 2 * poolSize)} random samples seed the population; infeasible
 * samples are dropped, and an empty population falls back to {@link GreedyRouteStrategy}.</li>
 * <li>Each generation keeps the elite and refills with crossover children, mutated with
 * {@code mutationRate}. An infeasible child is replaced by a random elite member.</li>
 * <li>The highest-value member of the last population is returned.</li>
 * </ul>
 */
@Slf4j
public final class PopulationRouteStrategy implements RouteSearchStrategy {
    private final PopulationSearchConfig config;
    private final GreedyRouteStrategy greedy;
    private final ExhaustiveRouteStrategy exhaustive;

    public PopulationRouteStrategy(PopulationSearchConfig config) {
        this(config, new GreedyRouteStrategy(), new ExhaustiveRouteStrategy());
    }

    PopulationRouteStrategy(
            PopulationSearchConfig config,
            GreedyRouteStrategy greedy,
            ExhaustiveRouteStrategy exhaustive
    ) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.greedy = Objects.requireNonNull(greedy, "greedy");
        this.exhaustive = Objects.requireNonNull(exhaustive, "exhaustive");
    }

    @Override
    public String id() {
        return RouteStrategyRegistry.STRATEGY_POPULATION;
    }

    @Override
    public List<Site> search(SearchContext context, Site start, SplittableRandom random) {
        Objects.requireNonNull(random, "random");
        List<Site> pool = context.candidatePool(start);
        if (pool.size() <= context.maxStops()) {
            return exhaustive.enumerate(context, start, pool);
        }

        int populationSize = Math.min(config.getPopulationSize(), pool.size() * 2);
        List<List<Site>> population = initialPopulation(context, start, pool, populationSize, random);
        if (population.isEmpty()) {
            log.debug("No feasible initial sample for start {} in zone {}, falling back to greedy",
                    start.id(), start.zone());
            return greedy.search(context, start, random);
        }

        int eliteSize = config.eliteSize(populationSize);
        for (int generation = 0; generation < config.getGenerations(); generation++) {
            List<List<Site>> elite = rankByValue(population).subList(0, Math.min(eliteSize, population.size()));
            List<List<Site>> next = new ArrayList<>(populationSize);
            next.addAll(elite);

            int discarded = 0;
            while (next.size() < populationSize) {
                List<Site> child = breed(context, pool, elite, random);
                if (context.isFeasible(start, child)) {
                    next.add(child);
                } else {
                    next.add(elite.get(random.nextInt(elite.size())));
                    discarded++;
                }
            }
            population = next;
            if (log.isTraceEnabled()) {
                log.trace("generation {} best={} discarded={}",
                        generation, SearchContext.totalValue(elite.get(0)), discarded);
            }
        }

        List<Site> best = rankByValue(population).get(0);
        return new ArrayList<>(best);
    }

    /**
     * Random feasible samples; may hold fewer than {@code populationSize} members.
     */
    List<List<Site>> initialPopulation(
            SearchContext context,
            Site start,
            List<Site> pool,
            int populationSize,
            SplittableRandom random
    ) {
        int maxSampleSize = Math.min(context.maxStops(), pool.size());
        List<List<Site>> population = new ArrayList<>(populationSize);
        if (maxSampleSize < 1) {
            return population;
        }
        for (int i = 0; i < populationSize; i++) {
            int size = random.nextInt(1, maxSampleSize + 1);
            List<Site> sample = GeneticOperators.sample(pool, size, random);
            if (context.isFeasible(start, sample)) {
                population.add(sample);
            }
        }
        return population;
    }

    private List<Site> breed(SearchContext context, List<Site> pool, List<List<Site>> elite, SplittableRandom random) {
        List<Site> parentA;
        List<Site> parentB;
        if (elite.size() == 1) {
            parentA = elite.get(0);
            parentB = parentA;
        } else {
            int first = random.nextInt(elite.size());
            int second = random.nextInt(elite.size() - 1);
            if (second >= first) {
                second++;
            }
            parentA = elite.get(first);
            parentB = elite.get(second);
        }

        List<Site> child = GeneticOperators.crossover(parentA, parentB, context.maxStops(), random);
        return GeneticOperators.maybeMutate(child, pool, context.maxStops(), config.getMutationRate(), random);
    }

    /**
     * Stable descending sort by total value; equal values keep population order.
     */
    private static List<List<Site>> rankByValue(List<List<Site>> population) {
        double[] values = new double[population.size()];
        Integer[] order = new Integer[population.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = SearchContext.totalValue(population.get(i));
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());

        List<List<Site>> ranked = new ArrayList<>(order.length);
        for (Integer index : order) {
            ranked.add(population.get(index));
        }
        return ranked;
    }
}
