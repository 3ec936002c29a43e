package com.boardroom.sim.model;

import com.boardroom.sim.config.DifficultySettings;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The CEO's tenure: board standing, financial track record and terminal flags.
 *
 * <p>Created once per game by {@link #initial(DifficultySettings)} and updated
 * only by the quarter engine through the {@code with*} transforms. Once
 * {@link #ousted()} or {@link #retired()} is set the game is over.
 *
 * <h3>Derived values</h3>
 * <ul>
 *   <li>{@link #momentumBonus()} — good-outcome bonus from the success streak</li>
 *   <li>{@link #smoothedProfit()} / {@link #profitTrajectory()} — read the recent-profit window</li>
 *   <li>{@link #parachutePayout()} — terminal payout from tenure, activity and evil score</li>
 * </ul>
 */
public record TenureState(
    @JsonProperty("pressure")                       int pressure,
    @JsonProperty("quartersSurvived")               int quartersSurvived,
    @JsonProperty("favorability")                   int favorability,
    @JsonProperty("ousted")                         boolean ousted,
    @JsonProperty("retired")                        boolean retired,
    @JsonProperty("totalProfit")                    int totalProfit,
    @JsonProperty("evilScore")                      int evilScore,
    @JsonProperty("evilScoreLastQuarter")           int evilScoreLastQuarter,
    @JsonProperty("lastQuarterProfit")              int lastQuarterProfit,
    @JsonProperty("currentQuarterProfit")           int currentQuarterProfit,
    @JsonProperty("recentProfits")                  List<Integer> recentProfits,
    @JsonProperty("consecutiveSuccesses")           int consecutiveSuccesses,
    @JsonProperty("consecutiveNegativeQuarters")    int consecutiveNegativeQuarters,
    @JsonProperty("consecutiveWeakProjectQuarters") int consecutiveWeakProjectQuarters,
    @JsonProperty("accumulatedBonus")               int accumulatedBonus,
    @JsonProperty("quarterlyBonusAwarded")          int quarterlyBonusAwarded,
    @JsonProperty("totalCardsPlayed")               int totalCardsPlayed
) {

    /** Number of quarters kept in the recent-profit window. */
    public static final int PROFIT_HISTORY_SIZE = 3;

    /** Pressure never exceeds this level. */
    public static final int MAX_PRESSURE = 8;

    /** Minimum golden parachute ($M). */
    private static final int BASE_PARACHUTE = 10;

    public TenureState {
        favorability = Math.max(0, Math.min(100, favorability));
        recentProfits = recentProfits == null ? List.of() : List.copyOf(recentProfits);
    }

    public static TenureState initial(DifficultySettings difficulty) {
        return new TenureState(1, 0, difficulty.startingFavorability(), false, false,
            0, 0, 0, 0, 0, List.of(), 0, 0, 0, 0, 0, 0);
    }

    // ── Derived ────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isTerminal() {
        return ousted || retired;
    }

    /** +5 at a streak of 3 or more, +3 at 2, otherwise 0. */
    public int momentumBonus() {
        if (consecutiveSuccesses >= 3) return 5;
        if (consecutiveSuccesses == 2) return 3;
        return 0;
    }

    /** Average of the recent-profit window, truncated; the current quarter's profit when empty. */
    public int smoothedProfit() {
        if (recentProfits.isEmpty()) return currentQuarterProfit;
        return (int) recentProfits.stream().mapToInt(Integer::intValue).average().orElse(0);
    }

    /** Most recent profit minus the truncated average of the older entries. */
    public int profitTrajectory() {
        if (recentProfits.size() < 2) return 0;
        int recent = recentProfits.get(recentProfits.size() - 1);
        double older = recentProfits.subList(0, recentProfits.size() - 1).stream()
            .mapToInt(Integer::intValue).average().orElse(0);
        return recent - (int) older;
    }

    @JsonIgnore
    public boolean isProfitImproving() {
        return profitTrajectory() > 0;
    }

    public int evilDeltaThisQuarter() {
        return evilScore - evilScoreLastQuarter;
    }

    /**
     * Golden parachute. A CEO who never executed a project gets the base
     * payout; otherwise tenure adds 3 per quarter and each evil point costs 2.
     */
    public int parachutePayout() {
        if (totalCardsPlayed == 0) return BASE_PARACHUTE;
        int tenureBonus = quartersSurvived * 3;
        int ethicsPenalty = evilScore * 2;
        return Math.max(BASE_PARACHUTE, BASE_PARACHUTE + tenureBonus - ethicsPenalty);
    }

    public boolean canRetire(DifficultySettings difficulty) {
        return accumulatedBonus >= difficulty.retirementThreshold();
    }

    // ── Transforms ─────────────────────────────────────────────────

    public TenureState withFavorabilityChange(int delta) {
        return new TenureState(pressure, quartersSurvived, favorability + delta, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withEvilScoreChange(int delta) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore + delta, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withCurrentQuarterProfitChange(int delta) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit + delta,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    /** Increments the quarter count and recomputes pressure as min(quarters / 2, 8). */
    public TenureState withQuarterComplete() {
        int quarters = quartersSurvived + 1;
        int newPressure = Math.min(quarters / 2, MAX_PRESSURE);
        return new TenureState(newPressure, quarters, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withProfitAdded(int profit) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit + profit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    /**
     * Appends to the recent-profit window (evicting the oldest beyond
     * {@value #PROFIT_HISTORY_SIZE}) and tracks the negative-quarter streak.
     */
    public TenureState withProfitRecorded(int quarterProfit) {
        List<Integer> profits = new ArrayList<>(recentProfits);
        profits.add(quarterProfit);
        while (profits.size() > PROFIT_HISTORY_SIZE) {
            profits.remove(0);
        }
        int negativeStreak = quarterProfit < 0 ? consecutiveNegativeQuarters + 1 : 0;
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            profits, consecutiveSuccesses, negativeStreak,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    /** A quarter whose project revenue is not positive extends the weak-project streak. */
    public TenureState withProjectPerformanceRecorded(int projectRevenue) {
        int weakStreak = projectRevenue <= 0 ? consecutiveWeakProjectQuarters + 1 : 0;
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            weakStreak, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withCardsPlayedRecorded(int cards) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed + cards);
    }

    public TenureState withBonusAwarded(int bonus) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus + bonus, bonus, totalCardsPlayed);
    }

    public TenureState withEvilSnapshotForQuarter() {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScore, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    /** Closes the books: the quarter's total becomes last quarter's profit and the project tally resets. */
    public TenureState withQuarterProfitClosed(int quarterProfit) {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, quarterProfit, 0,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    /**
     * Updates the success streak: a Good outcome extends it, a Bad outcome
     * resets it. Expected outcomes do not call this.
     */
    public TenureState withSuccessResult(boolean success) {
        int streak = success ? consecutiveSuccesses + 1 : 0;
        return new TenureState(pressure, quartersSurvived, favorability, ousted, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, streak, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withOusted() {
        return new TenureState(pressure, quartersSurvived, favorability, true, retired,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }

    public TenureState withRetirement() {
        return new TenureState(pressure, quartersSurvived, favorability, ousted, true,
            totalProfit, evilScore, evilScoreLastQuarter, lastQuarterProfit, currentQuarterProfit,
            recentProfits, consecutiveSuccesses, consecutiveNegativeQuarters,
            consecutiveWeakProjectQuarters, accumulatedBonus, quarterlyBonusAwarded, totalCardsPlayed);
    }
}
