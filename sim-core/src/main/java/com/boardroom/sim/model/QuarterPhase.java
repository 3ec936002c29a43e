package com.boardroom.sim.model;

/**
 * Phases of a quarter, in cycle order.
 *
 * <ul>
 *   <li>{@link #DEMAND}      — board directive bound, crisis possibly pre-selected</li>
 *   <li>{@link #PLAY_CARDS}  — projects played and economy actions taken</li>
 *   <li>{@link #CRISIS}      — follow-ups, due situations, crisis choice</li>
 *   <li>{@link #RESOLUTION}  — financials, favorability, survival roll</li>
 * </ul>
 */
public enum QuarterPhase {
    DEMAND,
    PLAY_CARDS,
    CRISIS,
    RESOLUTION;

    /** Phase that follows this one; RESOLUTION wraps back to DEMAND. */
    public QuarterPhase next() {
        return switch (this) {
            case DEMAND -> PLAY_CARDS;
            case PLAY_CARDS -> CRISIS;
            case CRISIS -> RESOLUTION;
            case RESOLUTION -> DEMAND;
        };
    }
}
