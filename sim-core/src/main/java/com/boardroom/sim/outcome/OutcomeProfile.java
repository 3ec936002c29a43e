package com.boardroom.sim.outcome;

import com.boardroom.sim.effect.Effect;
import com.boardroom.sim.model.OutcomeTier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Three effect lists, one per outcome tier.
 */
public record OutcomeProfile(
    @JsonProperty("good")     List<Effect> good,
    @JsonProperty("expected") List<Effect> expected,
    @JsonProperty("bad")      List<Effect> bad
) {

    public OutcomeProfile {
        good = good == null ? List.of() : List.copyOf(good);
        expected = expected == null ? List.of() : List.copyOf(expected);
        bad = bad == null ? List.of() : List.copyOf(bad);
    }

    /** Same effects whatever the tier. */
    public static OutcomeProfile uniform(List<Effect> effects) {
        return new OutcomeProfile(effects, effects, effects);
    }

    /** No effects at any tier. */
    public static OutcomeProfile neutral() {
        return new OutcomeProfile(List.of(), List.of(), List.of());
    }

    public List<Effect> effectsFor(OutcomeTier tier) {
        return switch (tier) {
            case GOOD -> good;
            case EXPECTED -> expected;
            case BAD -> bad;
        };
    }
}
