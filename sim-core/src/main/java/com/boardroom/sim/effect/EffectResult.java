package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.model.OrgState;

import java.util.List;

public record EffectResult(OrgState org, List<LogEntry> entries) {

    public EffectResult {
        entries = List.copyOf(entries);
    }
}
