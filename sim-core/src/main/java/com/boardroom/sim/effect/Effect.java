package com.boardroom.sim.effect;

import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of state effects carried by outcome profiles and choices.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Pure data</b>     — no references to game state</li>
 *   <li><b>Deterministic</b> — {@link #apply} never draws randomness and never fails</li>
 * </ul>
 *
 * <p>Only {@link MeterEffect} changes the organization here. {@link ProfitEffect}
 * and {@link FineEffect} only log; {@link EffectPipeline} collects them so the
 * quarter engine can aggregate money before Resolution.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MeterEffect.class, name = "meter"),
    @JsonSubTypes.Type(value = ProfitEffect.class, name = "profit"),
    @JsonSubTypes.Type(value = FineEffect.class, name = "fine")
})
public interface Effect {

    /**
     * Applies this effect to the organization.
     *
     * @param org current meters
     * @return updated meters plus the log entries describing the change
     */
    EffectResult apply(OrgState org);
}
