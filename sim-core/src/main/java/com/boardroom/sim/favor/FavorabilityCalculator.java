package com.boardroom.sim.favor;

import com.boardroom.sim.config.DifficultySettings;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a quarter's results into a board favorability delta.
 *
 * <h3>Classification</h3>
 * <ol>
 *   <li><strong>Full success</strong> — profit non-negative, directive met, profit grew.</li>
 *   <li><strong>Partial success</strong> — profit non-negative and directive met, but flat or down.</li>
 *   <li><strong>Failure</strong> — anything else.</li>
 * </ol>
 *
 * <p>Success paths earn a tenure-scaled reward, reduced by an evil penalty and
 * the weak-project streak penalty, and capped by a streak-dependent maximum
 * gain. The failure path accumulates profit, directive, pressure, evil
 * scrutiny and streak penalties, floored at a tenure-scaled maximum loss.
 *
 * <p>The separate adjustments ({@link #tenureDecay}, {@link #lowMeterAdjustment},
 * {@link #lowActivityAdjustment}) are applied by the quarter engine in that order.
 * Pure static utility; no state, no randomness.
 */
public final class FavorabilityCalculator {

    private static final int BASE_SUCCESS_REWARD = 8;
    private static final int MIN_SUCCESS_REWARD = 5;
    private static final int DIRECTIVE_FAILED_PENALTY = -4;

    private static final int NEGATIVE_PROFIT_PENALTY = -10;
    private static final int PROFIT_DECLINE_PENALTY = -3;
    private static final int FLAT_PROFIT_PENALTY = -1;

    /** Largest loss per quarter during the grace period. */
    private static final int BASE_MAX_LOSS = -12;

    /** First year of tenure: full rewards, tightest loss cap. */
    private static final int GRACE_PERIOD_QUARTERS = 4;

    private static final int EVIL_NOTICEABLE = 5;
    private static final int EVIL_CONCERNING = 10;
    private static final int EVIL_DANGEROUS = 20;

    private static final int CRITICAL_METER = 5;
    private static final int LOW_METER = 15;

    /** Marker for "no cap on positive gain". */
    public static final int NO_CAP = Integer.MAX_VALUE;

    private FavorabilityCalculator() { /* utility class */ }

    /**
     * A cap on positive gain plus an additive penalty, with a display reason.
     * {@code maxPositiveGain == NO_CAP} means uncapped.
     */
    public record FavorAdjustment(int maxPositiveGain, int penalty, String reason) {

        public static final FavorAdjustment NONE = new FavorAdjustment(NO_CAP, 0, null);

        public boolean isCapped() {
            return maxPositiveGain != NO_CAP;
        }

        /** Adds the penalty, then applies the cap. */
        public int applyTo(int change) {
            int result = change + penalty;
            return Math.min(result, maxPositiveGain);
        }
    }

    /**
     * Core favorability delta for the quarter.
     */
    public static int calculate(int lastProfit, int currentProfit, boolean directiveMet,
                                int pressure, int evilScore, int weakProjectStreak,
                                int quartersSurvived, DifficultySettings difficulty) {
        boolean profitUp = currentProfit > lastProfit;
        boolean success = currentProfit >= 0 && directiveMet;

        int streakPenalty = weakProjectStreakPenalty(weakProjectStreak);
        int maxGain = maxPositiveGain(weakProjectStreak);
        int reward = scaledSuccessReward(pressure, quartersSurvived, difficulty);

        if (success) {
            int base = profitUp ? reward : reward / 2;
            int gain = base - evilPenaltyOnSuccess(evilScore) + streakPenalty;
            return Math.min(gain, maxGain);
        }

        int change = 0;

        // ── Profit ─────────────────────────────────────────────────
        if (currentProfit < 0) {
            change += NEGATIVE_PROFIT_PENALTY;
            change -= Math.min(4, Math.abs(currentProfit) / 5);
        } else if (currentProfit < lastProfit) {
            int decline = lastProfit - currentProfit;
            if (decline > 10) {
                change += PROFIT_DECLINE_PENALTY * 2;
            } else if (decline > 5) {
                change += PROFIT_DECLINE_PENALTY;
            } else {
                change += FLAT_PROFIT_PENALTY;
            }
        }

        // ── Directive, pressure, scrutiny, streak ──────────────────
        if (!directiveMet) {
            change += DIRECTIVE_FAILED_PENALTY;
        }
        change -= pressure;
        change -= evilScrutinyOnFailure(evilScore);
        change += streakPenalty;

        return Math.max(change, maxLoss(quartersSurvived));
    }

    // ── Components ─────────────────────────────────────────────────

    /** 0, -1, -3, -5, then -7 for a streak of 4 or more. */
    public static int weakProjectStreakPenalty(int streak) {
        return switch (Math.max(0, streak)) {
            case 0 -> 0;
            case 1 -> -1;
            case 2 -> -3;
            case 3 -> -5;
            default -> -7;
        };
    }

    /** Uncapped, 6, 2, then 0 for a streak of 3 or more. */
    public static int maxPositiveGain(int streak) {
        return switch (Math.max(0, streak)) {
            case 0 -> NO_CAP;
            case 1 -> 6;
            case 2 -> 2;
            default -> 0;
        };
    }

    /**
     * Base reward plus the difficulty bonus. After the grace period, hard
     * tiers lose 1 at pressure 5+; never below {@value #MIN_SUCCESS_REWARD}.
     */
    public static int scaledSuccessReward(int pressure, int quartersSurvived, DifficultySettings difficulty) {
        int base = BASE_SUCCESS_REWARD + difficulty.successRewardBonus();
        if (quartersSurvived < GRACE_PERIOD_QUARTERS) {
            return base;
        }
        int pressurePenalty = difficulty.successRewardBonus() < 0 && pressure >= 5 ? 1 : 0;
        return Math.max(MIN_SUCCESS_REWARD, base - pressurePenalty);
    }

    /** -12 in the first year, then 2 more per year of tenure, down to -18. */
    public static int maxLoss(int quartersSurvived) {
        if (quartersSurvived < GRACE_PERIOD_QUARTERS) {
            return BASE_MAX_LOSS;
        }
        int tenureQuarters = quartersSurvived - GRACE_PERIOD_QUARTERS;
        return BASE_MAX_LOSS - Math.min(6, (tenureQuarters / 4) * 2);
    }

    static int evilPenaltyOnSuccess(int evilScore) {
        if (evilScore >= EVIL_DANGEROUS) return 3;
        if (evilScore >= EVIL_CONCERNING) return 1;
        return 0;
    }

    static int evilScrutinyOnFailure(int evilScore) {
        if (evilScore >= EVIL_DANGEROUS) return 8;
        if (evilScore >= EVIL_CONCERNING) return 4;
        if (evilScore >= EVIL_NOTICEABLE) return 2;
        return 0;
    }

    /** -1 per quarter once tenure reaches the tier's decay start, if enabled. */
    public static int tenureDecay(int quartersSurvived, DifficultySettings difficulty) {
        if (!difficulty.tenureDecayEnabled()) return 0;
        if (quartersSurvived < difficulty.tenureDecayStartQuarter()) return 0;
        return -1;
    }

    // ── Adjustments ────────────────────────────────────────────────

    /**
     * Critically low meters (below 5) block gains and add a penalty; several
     * low meters (5..14) cap gains at 2.
     */
    public static FavorAdjustment lowMeterAdjustment(OrgState org) {
        int lowCount = 0;
        List<String> critical = new ArrayList<>();
        for (Meter m : Meter.values()) {
            int value = org.getMeter(m);
            if (value < CRITICAL_METER) {
                critical.add(m.name());
            } else if (value < LOW_METER) {
                lowCount++;
            }
        }

        if (critical.size() >= 2) {
            return new FavorAdjustment(0, -5, "Multiple critical metrics: " + String.join(", ", critical));
        }
        if (critical.size() == 1) {
            return new FavorAdjustment(0, -2, "Critical metric: " + critical.get(0));
        }
        if (lowCount >= 3) {
            return new FavorAdjustment(2, 0, "Multiple metrics concerning");
        }
        return FavorAdjustment.NONE;
    }

    /** One project expected in the first two quarters, two afterwards. */
    public static int expectedProjectCount(int quartersSurvived) {
        return quartersSurvived < 2 ? 1 : 2;
    }

    /**
     * Penalizes running fewer projects than the board expects; the penalty
     * grows by one step every three quarters of tenure.
     */
    public static FavorAdjustment lowActivityAdjustment(int cardsPlayed, int quartersSurvived) {
        int expected = expectedProjectCount(quartersSurvived);
        if (cardsPlayed >= expected || quartersSurvived < 2) {
            return FavorAdjustment.NONE;
        }
        int multiplier = 1 + quartersSurvived / 3;
        if (cardsPlayed == 0) {
            return new FavorAdjustment(0, -5 * multiplier, "No strategic initiatives");
        }
        return new FavorAdjustment(0, -4 * multiplier,
            "Low activity (" + cardsPlayed + " of " + expected + " expected projects)");
    }
}
