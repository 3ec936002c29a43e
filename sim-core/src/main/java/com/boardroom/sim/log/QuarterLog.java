package com.boardroom.sim.log;

import com.boardroom.sim.model.QuarterPhase;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered log produced by one engine transition.
 */
public record QuarterLog(
    @JsonProperty("quarter") int quarter,
    @JsonProperty("phase")   QuarterPhase phase,
    @JsonProperty("entries") List<LogEntry> entries
) {

    public QuarterLog {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static QuarterLog create(int quarter, QuarterPhase phase) {
        return new QuarterLog(quarter, phase, List.of());
    }

    public QuarterLog withEntry(LogEntry entry) {
        List<LogEntry> next = new ArrayList<>(entries);
        next.add(entry);
        return new QuarterLog(quarter, phase, next);
    }

    public QuarterLog withEntries(List<LogEntry> more) {
        if (more.isEmpty()) return this;
        List<LogEntry> next = new ArrayList<>(entries);
        next.addAll(more);
        return new QuarterLog(quarter, phase, next);
    }

    public QuarterLog info(String message) {
        return withEntry(LogEntry.info(message));
    }

    public boolean containsMessage(String fragment) {
        return entries.stream().anyMatch(e -> e.message().contains(fragment));
    }
}
