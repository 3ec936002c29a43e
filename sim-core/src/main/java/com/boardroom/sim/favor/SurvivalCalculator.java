package com.boardroom.sim.favor;

import com.boardroom.sim.random.RandomSource;

/**
 * End-of-quarter board vote. Produces a d20 threshold; the CEO is ousted when
 * a roll of 1..20 lands at or below it.
 *
 * <h3>Threshold</h3>
 * <ol>
 *   <li>Favorability band: 55+ is safe (0, no roll), then 1 / 2 / 3 / 4.</li>
 *   <li>+ pressure / 2.</li>
 *   <li>Reductions, each floored at 0: honeymoon, clean record, active engagement.</li>
 *   <li>+ negative-quarter streak, + weak-project streak.</li>
 *   <li>Capped at {@value #MAX_THRESHOLD}; six weak quarters in a row is an automatic 20.</li>
 * </ol>
 */
public final class SurvivalCalculator {

    public static final int MAX_THRESHOLD = 14;
    public static final int AUTOMATIC_OUSTER = 20;

    private SurvivalCalculator() { /* utility class */ }

    /**
     * Inputs of the board vote, read after the quarter's tenure update.
     */
    public record VoteInput(
        int favorability,
        int pressure,
        int quartersSurvived,
        int evilScore,
        boolean directiveMet,
        boolean profitPositive,
        boolean profitImproving,
        int consecutiveNegativeQuarters,
        int consecutiveWeakProjectQuarters,
        int cardsPlayedThisQuarter
    ) {}

    public static int threshold(VoteInput in) {
        int base;
        if (in.favorability() >= 55) {
            return 0;
        } else if (in.favorability() >= 40) {
            base = 1;
        } else if (in.favorability() >= 25) {
            base = 2;
        } else if (in.favorability() >= 10) {
            base = 3;
        } else {
            base = 4;
        }

        int threshold = base + in.pressure() / 2;

        threshold = reduce(threshold, honeymoonReduction(in.quartersSurvived()));

        if (in.evilScore() == 0) {
            threshold = reduce(threshold, 2);
        } else if (in.evilScore() < 5) {
            threshold = reduce(threshold, 1);
        }

        // Base operations alone earn no credit with the board.
        boolean engaged = in.cardsPlayedThisQuarter() > 0;
        if (engaged && in.directiveMet()) threshold = reduce(threshold, 2);
        if (engaged && in.profitPositive()) threshold = reduce(threshold, 1);
        if (engaged && in.profitImproving()) threshold = reduce(threshold, 1);

        if (in.consecutiveNegativeQuarters() >= 3) {
            threshold += 4;
        } else if (in.consecutiveNegativeQuarters() >= 2) {
            threshold += 2;
        }

        int weak = in.consecutiveWeakProjectQuarters();
        if (weak >= 6) {
            return AUTOMATIC_OUSTER;
        } else if (weak >= 4) {
            threshold += 6;
        } else if (weak >= 2) {
            threshold += 3;
        }

        return Math.min(threshold, MAX_THRESHOLD);
    }

    /** 4 before quarter 4, 2 before 6, 1 before 8, then 0. */
    public static int honeymoonReduction(int quartersSurvived) {
        if (quartersSurvived < 4) return 4;
        if (quartersSurvived < 6) return 2;
        if (quartersSurvived < 8) return 1;
        return 0;
    }

    /** Risk as a percentage, 5 per threshold point. */
    public static int riskPercent(VoteInput in) {
        return threshold(in) * 5;
    }

    /**
     * Runs the vote. A threshold of 0 returns {@code false} without drawing.
     */
    public static boolean rollForOuster(VoteInput in, RandomSource rng) {
        int threshold = threshold(in);
        if (threshold == 0) {
            return false;
        }
        int roll = rng.nextInt(1, 21);
        return roll <= threshold;
    }

    private static int reduce(int threshold, int amount) {
        return Math.max(0, threshold - amount);
    }
}
