package com.robobracket.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Standard bracket seeding permutation: 1 meets N, 2 meets N-1, and the top two seeds can only meet in the final.
 */
public final class SeedOrderGenerator {

    private SeedOrderGenerator() {
    }

    /**
     * Seed order for a power-of-two bracket, e.g. {@code [1, 4, 2, 3]} for 4 and
     * {@code [1, 16, 8, 9, 4, 13, 5, 12, 2, 15, 7, 10, 3, 14, 6, 11]} for 16.
     */
    public static List<Integer> generateSeedOrder(int size) {
        if (size < 2 || Integer.bitCount(size) != 1) {
            throw UnsupportedSizeException.forSize(size);
        }
        List<Integer> order = List.of(1, 2);
        for (int current = 4; current <= size; current *= 2) {
            List<Integer> expanded = new ArrayList<>(current);
            for (int seed : order) {
                expanded.add(seed);
                expanded.add(current + 1 - seed);
            }
            order = expanded;
        }
        return List.copyOf(order);
    }

    /**
     * First-round match-ups, in bracket order: {@code (order[2i], order[2i+1])}.
     */
    public static List<SeedPair> firstRoundPairs(int size) {
        List<Integer> order = generateSeedOrder(size);
        List<SeedPair> pairs = new ArrayList<>(size / 2);
        for (int i = 0; i < order.size(); i += 2) {
            pairs.add(new SeedPair(order.get(i), order.get(i + 1)));
        }
        return List.copyOf(pairs);
    }

    public record SeedPair(
            int topSeed,
            int bottomSeed
    ) {
    }
}
