package com.boardroom.sim.economy;

import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.random.RandomSource;

/**
 * Quarterly financials: base operations (an independent stochastic process
 * lightly shaped by meter health and organic growth) and Revenue-card profit
 * scaling. All amounts are in millions.
 */
public final class ProfitCalculator {

    /** Organic growth per quarter survived. */
    private static final double GROWTH_PER_QUARTER = 0.02;

    /** Percent chance of a bad base-operations quarter. */
    private static final int BAD_QUARTER_CHANCE = 8;

    private static final int BASE_MIN = 80;
    private static final int BASE_MAX = 140;
    private static final int BAD_QUARTER_MIN = -30;
    private static final int BAD_QUARTER_MAX = 21;
    private static final int METER_BONUS = 10;
    private static final int METER_PENALTY = 15;
    private static final int VARIANCE = 15;

    private static final int HEALTHY_METER = 60;
    private static final int WEAK_METER = 35;

    /** Profit target at which revenue effects are unscaled. */
    private static final double REFERENCE_TARGET = 25.0;

    /** Multipliers for the 1st, 2nd and 3rd Revenue card of a quarter. */
    private static final double[] DIMINISHING_RETURNS = {1.0, 0.65, 0.35};

    private ProfitCalculator() { /* utility class */ }

    /**
     * Base operations profit.
     *
     * <p>Draw order: one {@code nextInt(0,100)} bad-quarter check; then either a
     * single bad-quarter draw, or a base draw followed by one variance draw.
     */
    public static int baseOperations(OrgState org, RandomSource rng, int quartersElapsed) {
        double growth = 1.0 + quartersElapsed * GROWTH_PER_QUARTER;

        if (rng.nextInt(0, 100) < BAD_QUARTER_CHANCE) {
            return rng.nextInt((int) (BAD_QUARTER_MIN * growth), (int) (BAD_QUARTER_MAX * growth));
        }

        int profit = rng.nextInt((int) (BASE_MIN * growth), (int) (BASE_MAX * growth) + 1);
        int bonus = (int) (METER_BONUS * growth);
        int penalty = (int) (METER_PENALTY * growth);

        profit += meterAdjustment(org.delivery(), bonus, penalty);
        profit += meterAdjustment(org.runway(), bonus, penalty);
        profit += meterAdjustment(org.governance(), bonus / 2, penalty / 2);

        int variance = (int) (VARIANCE * growth);
        profit += rng.nextInt(-variance, variance + 1);
        return profit;
    }

    /**
     * Scales a Revenue card's raw profit delta: relative to the directive target
     * (floor 0.5x), boosted by strong Delivery, and reduced for each Revenue card
     * already played this quarter. Truncates toward zero.
     */
    public static int scaleRevenueProfit(int rawDelta, int targetAmount, int delivery, int revenueCardsPlayedBefore) {
        double targetScale = Math.max(0.5, targetAmount / REFERENCE_TARGET);
        double deliveryMultiplier = delivery >= 90 ? 1.05 : delivery >= 80 ? 1.03 : 1.0;
        int index = Math.max(0, Math.min(DIMINISHING_RETURNS.length - 1, revenueCardsPlayedBefore));
        return (int) (rawDelta * targetScale * deliveryMultiplier * DIMINISHING_RETURNS[index]);
    }

    public static int total(int baseOperations, int projectImpact) {
        return baseOperations + projectImpact;
    }

    // ── Formatting ─────────────────────────────────────────────────

    /** {@code $85M}, {@code -$12M}, or {@code $1.2B} from 1000 upwards. */
    public static String format(int millions) {
        if (Math.abs(millions) >= 1000) {
            String billions = String.format(java.util.Locale.ROOT, "%.1f", Math.abs(millions) / 1000.0);
            return (millions < 0 ? "-$" : "$") + billions + "B";
        }
        return millions < 0 ? "-$" + Math.abs(millions) + "M" : "$" + millions + "M";
    }

    public static String formatWithSign(int millions) {
        return millions >= 0 ? "+" + format(millions) : format(millions);
    }

    private static int meterAdjustment(int value, int bonus, int penalty) {
        if (value >= HEALTHY_METER) return bonus;
        if (value < WEAK_METER) return -penalty;
        return 0;
    }
}
