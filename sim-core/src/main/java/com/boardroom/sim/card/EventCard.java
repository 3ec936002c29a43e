package com.boardroom.sim.card;

import com.boardroom.sim.exception.ContentValidationException;
import com.boardroom.sim.exception.IllegalMoveException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A crisis or situation presented to the player, with 2 to 4 uniquely
 * identified choices. Malformed content is rejected on construction.
 */
public record EventCard(
    @JsonProperty("eventId")     String eventId,
    @JsonProperty("title")       String title,
    @JsonProperty("description") String description,
    @JsonProperty("choices")     List<Choice> choices
) {

    public static final int MIN_CHOICES = 2;
    public static final int MAX_CHOICES = 4;

    public EventCard {
        if (choices == null || choices.size() < MIN_CHOICES || choices.size() > MAX_CHOICES) {
            throw new ContentValidationException("EventCard",
                eventId + " must have " + MIN_CHOICES + ".." + MAX_CHOICES + " choices, has "
                    + (choices == null ? 0 : choices.size()));
        }
        Set<String> ids = new HashSet<>();
        for (Choice c : choices) {
            if (!ids.add(c.choiceId())) {
                throw new ContentValidationException("EventCard",
                    eventId + " has duplicate choice id " + c.choiceId());
            }
        }
        choices = List.copyOf(choices);
    }

    public boolean hasChoice(String choiceId) {
        return choices.stream().anyMatch(c -> c.choiceId().equals(choiceId));
    }

    public Choice getChoice(String choiceId) {
        return choices.stream()
            .filter(c -> c.choiceId().equals(choiceId))
            .findFirst()
            .orElseThrow(() -> new IllegalMoveException("EventCard",
                "Unknown choice " + choiceId + " for event " + eventId));
    }
}
