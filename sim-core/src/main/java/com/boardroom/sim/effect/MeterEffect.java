package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Adds {@code delta} to one meter; the result is clamped by {@link OrgState}.
 */
public record MeterEffect(
    @JsonProperty("meter") Meter meter,
    @JsonProperty("delta") int delta
) implements Effect {

    public MeterEffect {
        if (meter == null) {
            throw new IllegalArgumentException("meter must not be null");
        }
    }

    @Override
    public EffectResult apply(OrgState org) {
        return new EffectResult(org.withMeterChange(meter, delta), List.of(LogEntry.meterChange(meter, delta)));
    }
}
