package com.boardroom.sim.random;

import java.util.List;

/**
 * The only channel for nondeterminism in the simulation.
 *
 * <p>Implementations must be reproducible: two sources created from the same
 * seed return the same draw sequence. A source is owned by one transition at
 * a time; draws from concurrent transitions must never interleave.
 *
 * <p>Current implementation: {@link SeededRandomSource}.
 */
public interface RandomSource {

    /**
     * Draws an integer in {@code [minInclusive, maxExclusive)}.
     * Returns {@code minInclusive} when the range is empty.
     *
     * @throws IllegalArgumentException if {@code maxExclusive < minInclusive}
     */
    int nextInt(int minInclusive, int maxExclusive);

    /** Draws a value in {@code [0.0, 1.0)}. */
    double nextDouble();

    /**
     * Fisher-Yates shuffle in place: for {@code i} from {@code n-1} down to 1,
     * swap element {@code i} with element {@code nextInt(0, i + 1)}.
     */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = nextInt(0, i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }
}
