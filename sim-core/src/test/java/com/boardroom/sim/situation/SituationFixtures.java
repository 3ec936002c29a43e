package com.boardroom.sim.situation;

import com.boardroom.sim.effect.MeterEffect;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.outcome.OutcomeProfile;

import java.util.List;

/** Hand-built situation content for tests. */
final class SituationFixtures {

    private SituationFixtures() { }

    static SituationDefinition situation(String id, SituationSeverity severity) {
        OutcomeProfile profile = new OutcomeProfile(
            List.of(new MeterEffect(Meter.MORALE, 5)),
            List.of(new MeterEffect(Meter.MORALE, -2)),
            List.of(new MeterEffect(Meter.MORALE, -8)));
        return new SituationDefinition(id, "Title of " + id, "Something happened", severity, List.of(
            SituationResponse.pc("Pay for it", null, 2, profile),
            SituationResponse.risk("Wing it", null, profile),
            SituationResponse.evil("Cover it up", null, 3, profile),
            SituationResponse.defer()));
    }

    static List<SituationDefinition> requiredSituations() {
        return SituationIds.REQUIRED.stream()
            .map(id -> situation(id, SituationSeverity.MODERATE))
            .toList();
    }
}
