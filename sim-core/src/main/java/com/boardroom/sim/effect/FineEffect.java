package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.model.OrgState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Monetary penalty in millions, deducted from the quarter's financial result.
 * Negative amounts are treated as zero.
 */
public record FineEffect(
    @JsonProperty("amount") int amount,
    @JsonProperty("reason") String reason
) implements Effect {

    public static final String DEFAULT_REASON = "Legal settlement";

    public FineEffect {
        amount = Math.max(0, amount);
        reason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
    }

    public FineEffect(int amount) {
        this(amount, DEFAULT_REASON);
    }

    @Override
    public EffectResult apply(OrgState org) {
        return new EffectResult(org, List.of(LogEntry.info("Fine: $" + amount + "M (" + reason + ")")));
    }
}
