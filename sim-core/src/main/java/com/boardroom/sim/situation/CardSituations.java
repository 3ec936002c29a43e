package com.boardroom.sim.situation;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.RandomSource;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * The situations a specific card can set off.
 */
public record CardSituations(
    @JsonProperty("cardId")   String cardId,
    @JsonProperty("triggers") List<SituationTrigger> triggers
) {

    public CardSituations {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public List<SituationTrigger> matching(OutcomeTier outcome) {
        return triggers.stream().filter(t -> t.matches(outcome)).toList();
    }

    /**
     * Weighted pick among the triggers matching {@code outcome}. Draws once
     * from {@code rng} with {@code nextInt(1, total + 1)}; draws nothing when
     * no trigger matches.
     */
    public Optional<SituationTrigger> selectTrigger(OutcomeTier outcome, RandomSource rng) {
        List<SituationTrigger> candidates = matching(outcome);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int total = candidates.stream().mapToInt(SituationTrigger::weight).sum();
        int roll = rng.nextInt(1, total + 1);
        int cumulative = 0;
        for (SituationTrigger t : candidates) {
            cumulative += t.weight();
            if (roll <= cumulative) {
                return Optional.of(t);
            }
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }
}
