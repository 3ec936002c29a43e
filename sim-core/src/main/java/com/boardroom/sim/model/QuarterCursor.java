package com.boardroom.sim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Position of the game in time: 1-based quarter number and current phase.
 */
public record QuarterCursor(
    @JsonProperty("quarterNumber") int quarterNumber,
    @JsonProperty("phase")         QuarterPhase phase
) {

    public QuarterCursor {
        if (quarterNumber < 1) {
            throw new IllegalArgumentException("quarterNumber must be >= 1, was " + quarterNumber);
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
    }

    public static QuarterCursor initial() {
        return new QuarterCursor(1, QuarterPhase.DEMAND);
    }

    /**
     * Advances one phase. Leaving RESOLUTION starts the next quarter.
     */
    public QuarterCursor nextPhase() {
        QuarterPhase next = phase.next();
        int quarter = phase == QuarterPhase.RESOLUTION ? quarterNumber + 1 : quarterNumber;
        return new QuarterCursor(quarter, next);
    }
}
