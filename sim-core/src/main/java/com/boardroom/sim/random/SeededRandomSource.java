package com.boardroom.sim.random;

import java.util.Random;

/**
 * {@link RandomSource} backed by a seeded {@link Random}. The same seed always
 * yields the same sequence of draws.
 */
public final class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int minInclusive, int maxExclusive) {
        if (maxExclusive < minInclusive) {
            throw new IllegalArgumentException(
                "maxExclusive " + maxExclusive + " < minInclusive " + minInclusive);
        }
        if (maxExclusive == minInclusive) return minInclusive;
        return minInclusive + random.nextInt(maxExclusive - minInclusive);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "SeededRandomSource{seed=" + seed + "}";
    }
}
