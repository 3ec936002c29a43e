package com.boardroom.sim.situation;

import com.boardroom.sim.model.OutcomeTier;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A played project that may still produce consequences. Eligible for
 * {@value #MAX_QUARTERS_ELIGIBLE} quarters after the quarter it was played.
 */
public record PendingFollowUp(
    @JsonProperty("cardId")          String cardId,
    @JsonProperty("cardTitle")       String cardTitle,
    @JsonProperty("threadId")        String threadId,
    @JsonProperty("playedAtQuarter") int playedAtQuarter,
    @JsonProperty("originalOutcome") OutcomeTier originalOutcome
) {

    public static final int MAX_QUARTERS_ELIGIBLE = 3;

    public int quartersSincePlayed(int currentQuarter) {
        return currentQuarter - playedAtQuarter;
    }

    public boolean hasExpired(int currentQuarter) {
        return quartersSincePlayed(currentQuarter) > MAX_QUARTERS_ELIGIBLE;
    }
}
