package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Profit impact in millions. Logged here; counted into the quarter's project
 * profit by the engine, and only for Revenue cards.
 */
public record ProfitEffect(@JsonProperty("delta") int delta) implements Effect {

    @Override
    public EffectResult apply(OrgState org) {
        String sign = delta >= 0 ? "+" : "-";
        return new EffectResult(org, List.of(LogEntry.info("Profit " + sign + "$" + Math.abs(delta) + "M")));
    }
}
