package com.boardroom.sim.economy;

import com.boardroom.sim.exception.InsufficientCapitalException;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Political Capital balance, clamped to [0, {@value #MAX_CAPITAL}].
 *
 * <h3>Earning and losing</h3>
 * <ul>
 *   <li>End of quarter: +1 governance ≥ 60, +1 alignment ≥ 60, -1 morale &lt; 30,
 *       -1 decay while above {@value #DECAY_THRESHOLD}; summed, then clamped.</li>
 *   <li>Restraint bonus for playing few cards: 3 / 2 / 1 / 0 PC.</li>
 *   <li>Meter exchange: trade meter points for 1 PC.</li>
 * </ul>
 *
 * <p>Spends are atomic: an unaffordable spend throws and the receiver is unchanged.
 */
public record ResourceState(@JsonProperty("politicalCapital") int politicalCapital) {

    public static final int MAX_CAPITAL = 20;

    /** Balance above which 1 PC decays each quarter. */
    public static final int DECAY_THRESHOLD = 10;

    public static final int INITIAL_CAPITAL = 10;

    /** Meter level that earns PC for governance and alignment. */
    private static final int HEALTHY_METER = 60;

    /** Morale below this costs PC. */
    private static final int LOW_MORALE = 30;

    public ResourceState {
        politicalCapital = Math.max(0, Math.min(MAX_CAPITAL, politicalCapital));
    }

    public static ResourceState initial() {
        return new ResourceState(INITIAL_CAPITAL);
    }

    public boolean canAfford(int cost) {
        return politicalCapital >= cost;
    }

    public ResourceState spend(int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative, was " + cost);
        }
        if (!canAfford(cost)) {
            throw new InsufficientCapitalException(politicalCapital, cost);
        }
        return new ResourceState(politicalCapital - cost);
    }

    /** Adds (or with a negative delta removes) capital, clamped to the valid range. */
    public ResourceState earn(int delta) {
        return new ResourceState(politicalCapital + delta);
    }

    public int endOfQuarterDelta(OrgState org) {
        int delta = 0;
        if (org.governance() >= HEALTHY_METER) delta += 1;
        if (org.alignment() >= HEALTHY_METER) delta += 1;
        if (org.morale() < LOW_MORALE) delta -= 1;
        if (politicalCapital > DECAY_THRESHOLD) delta -= 1;
        return delta;
    }

    public ResourceState withEndOfQuarterAdjustments(OrgState org) {
        return earn(endOfQuarterDelta(org));
    }

    // ── Static rules ───────────────────────────────────────────────

    /** 3 PC for no cards, 2 for one, 1 for two, nothing for three or more. */
    public static int restraintBonus(int cardsPlayed) {
        return switch (cardsPlayed) {
            case 0 -> 3;
            case 1 -> 2;
            case 2 -> 1;
            default -> 0;
        };
    }

    /** Meter points traded for 1 PC: Governance 15, Runway 20, the rest 10. */
    public static int exchangeCost(Meter meter) {
        return switch (meter) {
            case DELIVERY, MORALE, ALIGNMENT -> 10;
            case GOVERNANCE -> 15;
            case RUNWAY -> 20;
        };
    }

    public static boolean canExchange(OrgState org, Meter meter) {
        return org.getMeter(meter) >= exchangeCost(meter);
    }
}
