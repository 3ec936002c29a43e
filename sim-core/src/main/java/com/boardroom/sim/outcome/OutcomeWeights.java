package com.boardroom.sim.outcome;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.RandomSource;

/**
 * Non-negative Good/Expected/Bad weights. Shares are relative to their sum,
 * which need not be 100.
 */
public record OutcomeWeights(int good, int expected, int bad) {

    public OutcomeWeights {
        if (good < 0 || expected < 0 || bad < 0) {
            throw new IllegalArgumentException(
                "weights must be non-negative: " + good + "/" + expected + "/" + bad);
        }
    }

    public int total() {
        return good + expected + bad;
    }

    /**
     * One draw of {@code nextInt(0, total)}: below {@code good} is Good, below
     * {@code good + expected} is Expected, otherwise Bad. A zero total
     * resolves to Expected without drawing.
     */
    public OutcomeTier roll(RandomSource rng) {
        int total = total();
        if (total == 0) return OutcomeTier.EXPECTED;

        int roll = rng.nextInt(0, total);
        if (roll < good) return OutcomeTier.GOOD;
        if (roll < good + expected) return OutcomeTier.EXPECTED;
        return OutcomeTier.BAD;
    }
}
