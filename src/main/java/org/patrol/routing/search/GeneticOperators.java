package org.patrol.routing.search;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.experimental.UtilityClass;
import org.patrol.routing.catalog.Site;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Randomized building blocks of the population search.
 *
 * <p>Every operator is a pure function of its arguments and the supplied generator:
 * inputs are never modified and a fresh list is returned.</p>
 */
@UtilityClass
public final class GeneticOperators {

    /**
     * Mutation kinds, drawn uniformly.
     */
    public enum Mutation {
        ADD,
        REMOVE,
        REPLACE
    }

    /**
     * Draws {@code count} distinct sites from {@code pool} in random order.
     */
    public static List<Site> sample(List<Site> pool, int count, SplittableRandom random) {
        Objects.requireNonNull(random, "random");
        if (count < 0 || count > pool.size()) {
            throw new IllegalArgumentException("count out of bounds: " + count + " [0, " + pool.size() + "]");
        }
        List<Site> shuffled = new ArrayList<>(pool);
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(shuffled.size() - i);
            Site tmp = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, tmp);
        }
        return new ArrayList<>(shuffled.subList(0, count));
    }

    /**
     * Unions the parents' site ids, then keeps a random subset of size
     * {@code 1..min(maxStops, |union|)}.
     *
     * @return child stops; empty only when both parents are empty.
     */
    public static List<Site> crossover(List<Site> parentA, List<Site> parentB, int maxStops, SplittableRandom random) {
        IntLinkedOpenHashSet unionIds = new IntLinkedOpenHashSet(parentA.size() + parentB.size());
        Int2ObjectOpenHashMap<Site> sitesById = new Int2ObjectOpenHashMap<>(parentA.size() + parentB.size());
        for (Site site : parentA) {
            unionIds.add(site.id());
            sitesById.put(site.id(), site);
        }
        for (Site site : parentB) {
            unionIds.add(site.id());
            sitesById.put(site.id(), site);
        }

        int upper = Math.min(maxStops, unionIds.size());
        if (upper < 1) {
            return new ArrayList<>();
        }
        int childSize = random.nextInt(1, upper + 1);

        IntArrayList ids = new IntArrayList(unionIds);
        List<Site> child = new ArrayList<>(childSize);
        for (int i = 0; i < childSize; i++) {
            int j = i + random.nextInt(ids.size() - i);
            int picked = ids.getInt(j);
            ids.set(j, ids.getInt(i));
            ids.set(i, picked);
            child.add(sitesById.get(picked));
        }
        return child;
    }

    /**
     * Applies one uniformly chosen {@link Mutation}.
     *
     * <p>ADD appends an unused pool site when the route has fewer than {@code maxStops}
     * stops; REMOVE drops a random stop when more than one is present; REPLACE swaps a
     * random stop for an unused pool site. A mutation whose precondition fails leaves
     * the copy unchanged.</p>
     */
    public static List<Site> mutate(List<Site> route, List<Site> pool, int maxStops, SplittableRandom random) {
        if (route.isEmpty()) {
            return new ArrayList<>();
        }
        Mutation mutation = Mutation.values()[random.nextInt(Mutation.values().length)];
        return apply(mutation, route, pool, maxStops, random);
    }

    /**
     * Mutates a copy of {@code route} with probability {@code mutationRate}; otherwise
     * returns an unchanged copy. Draws the gate before any mutation choice.
     */
    public static List<Site> maybeMutate(
            List<Site> route,
            List<Site> pool,
            int maxStops,
            double mutationRate,
            SplittableRandom random
    ) {
        if (random.nextDouble() < mutationRate) {
            return mutate(route, pool, maxStops, random);
        }
        return new ArrayList<>(route);
    }

    /**
     * Applies a specific mutation to a copy of {@code route}.
     */
    public static List<Site> apply(
            Mutation mutation,
            List<Site> route,
            List<Site> pool,
            int maxStops,
            SplittableRandom random
    ) {
        List<Site> mutated = new ArrayList<>(route);
        switch (mutation) {
            case ADD -> {
                if (mutated.size() < maxStops) {
                    List<Site> unused = unused(mutated, pool);
                    if (!unused.isEmpty()) {
                        mutated.add(unused.get(random.nextInt(unused.size())));
                    }
                }
            }
            case REMOVE -> {
                if (mutated.size() > 1) {
                    mutated.remove(random.nextInt(mutated.size()));
                }
            }
            case REPLACE -> {
                if (!mutated.isEmpty()) {
                    List<Site> unused = unused(mutated, pool);
                    if (!unused.isEmpty()) {
                        int index = random.nextInt(mutated.size());
                        mutated.set(index, unused.get(random.nextInt(unused.size())));
                    }
                }
            }
        }
        return mutated;
    }

    private static List<Site> unused(List<Site> route, List<Site> pool) {
        IntSet usedIds = new IntOpenHashSet(route.size());
        for (Site site : route) {
            usedIds.add(site.id());
        }
        List<Site> unused = new ArrayList<>(pool.size());
        for (Site site : pool) {
            if (!usedIds.contains(site.id())) {
                unused.add(site);
            }
        }
        return unused;
    }
}
