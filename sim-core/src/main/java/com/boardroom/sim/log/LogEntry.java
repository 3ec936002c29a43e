package com.boardroom.sim.log;

import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OutcomeTier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One machine-readable line of the quarter log.
 *
 * <p>{@code meter}/{@code delta} are set only for {@link LogCategory#METER_CHANGE};
 * {@code tier} only for {@link LogCategory#OUTCOME}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
    @JsonProperty("category") LogCategory category,
    @JsonProperty("message")  String message,
    @JsonProperty("meter")    Meter meter,
    @JsonProperty("delta")    Integer delta,
    @JsonProperty("tier")     OutcomeTier tier
) {

    public static LogEntry info(String message) {
        return new LogEntry(LogCategory.INFO, message, null, null, null);
    }

    public static LogEntry event(String message) {
        return new LogEntry(LogCategory.EVENT, message, null, null, null);
    }

    public static LogEntry meterChange(Meter meter, int delta) {
        String sign = delta >= 0 ? "+" : "";
        return new LogEntry(LogCategory.METER_CHANGE, meter + " " + sign + delta, meter, delta, null);
    }

    /** Outcome line in the form {@code [tier] title: label}. */
    public static LogEntry outcome(OutcomeTier tier, String title, String label) {
        return new LogEntry(LogCategory.OUTCOME, "[" + tier + "] " + title + ": " + label, null, null, tier);
    }
}
