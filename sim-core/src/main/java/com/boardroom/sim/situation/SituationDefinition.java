package com.boardroom.sim.situation;

import com.boardroom.sim.card.Choice;
import com.boardroom.sim.card.EventCard;
import com.boardroom.sim.exception.ContentValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A situation that can be queued by a card play or a project follow-up and
 * later surfaces in the Crisis phase.
 *
 * <p>Exactly four responses, one per {@link ResponseType}; anything else is
 * rejected on construction.
 */
public record SituationDefinition(
    @JsonProperty("situationId") String situationId,
    @JsonProperty("title")       String title,
    @JsonProperty("description") String description,
    @JsonProperty("severity")    SituationSeverity severity,
    @JsonProperty("responses")   List<SituationResponse> responses
) {

    public static final String CHOICE_SEPARATOR = "_";

    public SituationDefinition {
        if (situationId == null || situationId.isBlank()) {
            throw new ContentValidationException("SituationDefinition", "situationId must not be blank");
        }
        if (severity == null) {
            throw new ContentValidationException("SituationDefinition", situationId + " has no severity");
        }
        if (responses == null || responses.size() != ResponseType.values().length) {
            throw new ContentValidationException("SituationDefinition",
                situationId + " must have exactly 4 responses, has " + (responses == null ? 0 : responses.size()));
        }
        Set<ResponseType> seen = EnumSet.noneOf(ResponseType.class);
        for (SituationResponse r : responses) {
            if (!seen.add(r.type())) {
                throw new ContentValidationException("SituationDefinition",
                    situationId + " has more than one " + r.type() + " response");
            }
        }
        responses = List.copyOf(responses);
    }

    public SituationResponse response(ResponseType type) {
        return responses.stream()
            .filter(r -> r.type() == type)
            .findFirst()
            .orElseThrow();
    }

    /** Choice id of a response, e.g. {@code SIT_KEY_PERFORMER_QUITS_DEFER}. */
    public String choiceId(ResponseType type) {
        return situationId + CHOICE_SEPARATOR + type.name();
    }

    public boolean isDeferChoice(String choiceId) {
        return choiceId(ResponseType.DEFER).equals(choiceId);
    }

    /** Severity after {@code deferCount} escalations. */
    public SituationSeverity effectiveSeverity(int deferCount) {
        return severity.escalate(deferCount);
    }

    /**
     * Event card for the Crisis phase. The Defer choice is omitted once the
     * effective severity reaches Critical.
     */
    public EventCard toEventCard(int deferCount) {
        boolean deferrable = effectiveSeverity(deferCount).canDefer();
        List<Choice> choices = new ArrayList<>();
        for (SituationResponse r : responses) {
            String id = choiceId(r.type());
            switch (r.type()) {
                case PC -> choices.add(Choice.withPcCost(id, r.label(), r.effectivePcCost(), r.outcomes()));
                case RISK -> choices.add(Choice.tiered(id, r.label(), r.outcomes()));
                case EVIL -> choices.add(Choice.corporate(id, r.label(), r.outcomes(), r.effectiveEvilDelta()));
                case DEFER -> {
                    if (deferrable) {
                        choices.add(Choice.flat(id, r.label()));
                    }
                }
            }
        }
        return new EventCard(situationId, title, description, choices);
    }
}
