package com.boardroom.sim.situation;

import com.boardroom.sim.outcome.OutcomeProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One response option of a {@link SituationDefinition}.
 *
 * @param pcCost    Political Capital charged up front (PC responses; 2 when unset)
 * @param evilDelta evil score added on resolution (Evil responses; 2 when unset)
 */
public record SituationResponse(
    @JsonProperty("type")        ResponseType type,
    @JsonProperty("label")       String label,
    @JsonProperty("description") String description,
    @JsonProperty("pcCost")      int pcCost,
    @JsonProperty("evilDelta")   int evilDelta,
    @JsonProperty("outcomes")    OutcomeProfile outcomes
) {

    public static final String DEFAULT_DEFER_LABEL = "Put this aside for now";
    public static final String DEFAULT_DEFER_DESCRIPTION = "This might come back later with increased severity";

    static final int DEFAULT_PC_COST = 2;
    static final int DEFAULT_EVIL_DELTA = 2;

    public SituationResponse {
        if (type == null) {
            throw new IllegalArgumentException("response type is required");
        }
        if (outcomes == null) {
            outcomes = OutcomeProfile.neutral();
        }
        if (type == ResponseType.DEFER && (label == null || label.isBlank())) {
            label = DEFAULT_DEFER_LABEL;
            description = description == null ? DEFAULT_DEFER_DESCRIPTION : description;
        }
    }

    public static SituationResponse pc(String label, String description, int pcCost, OutcomeProfile outcomes) {
        return new SituationResponse(ResponseType.PC, label, description, pcCost, 0, outcomes);
    }

    public static SituationResponse risk(String label, String description, OutcomeProfile outcomes) {
        return new SituationResponse(ResponseType.RISK, label, description, 0, 0, outcomes);
    }

    public static SituationResponse evil(String label, String description, int evilDelta, OutcomeProfile outcomes) {
        return new SituationResponse(ResponseType.EVIL, label, description, 0, evilDelta, outcomes);
    }

    public static SituationResponse defer() {
        return new SituationResponse(ResponseType.DEFER, DEFAULT_DEFER_LABEL, DEFAULT_DEFER_DESCRIPTION,
            0, 0, OutcomeProfile.neutral());
    }

    /** PC cost charged when chosen; 0 for every type but PC. */
    public int effectivePcCost() {
        if (type != ResponseType.PC) return 0;
        return pcCost > 0 ? pcCost : DEFAULT_PC_COST;
    }

    /** Corporate intensity of the choice; 0 for every type but Evil. */
    public int effectiveEvilDelta() {
        if (type != ResponseType.EVIL) return 0;
        return evilDelta > 0 ? evilDelta : DEFAULT_EVIL_DELTA;
    }
}
