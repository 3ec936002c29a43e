package com.boardroom.sim.situation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A situation queued to fire in a future quarter.
 *
 * @param scheduledQuarter first quarter in which it may surface
 * @param queuedAtQuarter  quarter it entered the queue; orders deferred-list eviction
 * @param deferCount       times the player has deferred it; each one escalates severity
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingSituation(
    @JsonProperty("situationId")         String situationId,
    @JsonProperty("originCardId")        String originCardId,
    @JsonProperty("scheduledQuarter")    int scheduledQuarter,
    @JsonProperty("queuedAtQuarter")     int queuedAtQuarter,
    @JsonProperty("deferCount")          int deferCount,
    @JsonProperty("originatingThreadId") String originatingThreadId
) {

    public static PendingSituation create(String situationId, String originCardId,
                                          int currentQuarter, int delayQuarters, String threadId) {
        return new PendingSituation(situationId, originCardId,
            currentQuarter + delayQuarters, currentQuarter, 0, threadId);
    }

    public boolean isDueAt(int quarter) {
        return scheduledQuarter <= quarter;
    }

    /** Reschedules to next quarter and counts the deferral. */
    public PendingSituation withDeferred(int currentQuarter) {
        return new PendingSituation(situationId, originCardId, currentQuarter + 1,
            queuedAtQuarter, deferCount + 1, originatingThreadId);
    }

    public PendingSituation withScheduledQuarter(int quarter) {
        return new PendingSituation(situationId, originCardId, quarter,
            queuedAtQuarter, deferCount, originatingThreadId);
    }
}
