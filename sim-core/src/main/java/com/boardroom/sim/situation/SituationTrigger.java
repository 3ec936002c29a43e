package com.boardroom.sim.situation;

import com.boardroom.sim.model.OutcomeTier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A weighted link from a card outcome to a situation. A {@code null}
 * {@code onOutcome} matches every tier.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SituationTrigger(
    @JsonProperty("situationId") String situationId,
    @JsonProperty("onOutcome")   OutcomeTier onOutcome,
    @JsonProperty("weight")      int weight
) {

    public SituationTrigger {
        if (weight <= 0) {
            throw new IllegalArgumentException("trigger weight must be positive, was " + weight);
        }
    }

    public boolean matches(OutcomeTier outcome) {
        return onOutcome == null || onOutcome == outcome;
    }
}
