package com.boardroom.sim.card;

import com.boardroom.sim.effect.Effect;
import com.boardroom.sim.outcome.OutcomeProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One option of an {@link EventCard}.
 *
 * <p>Either flat ({@code effects} always applied) or tiered ({@code outcomeProfile}
 * rolled on a crisis table). A PC cost is paid before the roll; a corporate
 * intensity is paid in evil score after it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Choice(
    @JsonProperty("choiceId")                String choiceId,
    @JsonProperty("label")                   String label,
    @JsonProperty("effects")                 List<Effect> effects,
    @JsonProperty("outcomeProfile")          OutcomeProfile outcomeProfile,
    @JsonProperty("corporateIntensityDelta") int corporateIntensityDelta,
    @JsonProperty("pcCost")                  int pcCost
) {

    public Choice {
        if (choiceId == null || choiceId.isBlank()) {
            throw new IllegalArgumentException("choiceId must not be blank");
        }
        effects = effects == null ? List.of() : List.copyOf(effects);
        if (pcCost < 0) {
            throw new IllegalArgumentException("pcCost must be non-negative, was " + pcCost);
        }
    }

    public static Choice flat(String choiceId, String label, Effect... effects) {
        return new Choice(choiceId, label, List.of(effects), null, 0, 0);
    }

    public static Choice tiered(String choiceId, String label, OutcomeProfile profile) {
        return new Choice(choiceId, label, List.of(), profile, 0, 0);
    }

    public static Choice corporate(String choiceId, String label, OutcomeProfile profile, int intensity) {
        return new Choice(choiceId, label, List.of(), profile, intensity, 0);
    }

    public static Choice withPcCost(String choiceId, String label, int pcCost, OutcomeProfile profile) {
        return new Choice(choiceId, label, List.of(), profile, 0, pcCost);
    }

    @JsonIgnore
    public boolean isTiered() {
        return outcomeProfile != null;
    }

    @JsonIgnore
    public boolean isCorporate() {
        return corporateIntensityDelta > 0;
    }

    public boolean requiresCapital() {
        return pcCost > 0;
    }
}
