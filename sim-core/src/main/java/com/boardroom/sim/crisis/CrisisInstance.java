package com.boardroom.sim.crisis;

import com.boardroom.sim.model.Meter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A long-running crisis tracked across quarters.
 *
 * <p>While active, {@code ongoingImpact} is applied at every Resolution. Once
 * the quarter passes {@code deadlineQuarter} the crisis expires and
 * {@code baseImpact} is applied once.
 */
public record CrisisInstance(
    @JsonProperty("crisisId")        String crisisId,
    @JsonProperty("instanceId")      String instanceId,
    @JsonProperty("title")           String title,
    @JsonProperty("severity")        int severity,
    @JsonProperty("createdQuarter")  int createdQuarter,
    @JsonProperty("deadlineQuarter") int deadlineQuarter,
    @JsonProperty("baseImpact")      Map<Meter, Integer> baseImpact,
    @JsonProperty("ongoingImpact")   Map<Meter, Integer> ongoingImpact,
    @JsonProperty("status")          CrisisStatus status
) {

    public CrisisInstance {
        baseImpact = ordered(baseImpact);
        ongoingImpact = ordered(ongoingImpact);
        status = status == null ? CrisisStatus.ACTIVE : status;
    }

    private static Map<Meter, Integer> ordered(Map<Meter, Integer> impact) {
        EnumMap<Meter, Integer> copy = new EnumMap<>(Meter.class);
        if (impact != null) {
            copy.putAll(impact);
        }
        return Collections.unmodifiableMap(copy);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == CrisisStatus.ACTIVE;
    }

    public boolean isOverdue(int quarter) {
        return quarter > deadlineQuarter;
    }

    public int quartersRemaining(int quarter) {
        return Math.max(0, deadlineQuarter - quarter);
    }

    public CrisisInstance withStatus(CrisisStatus newStatus) {
        return new CrisisInstance(crisisId, instanceId, title, severity, createdQuarter,
            deadlineQuarter, baseImpact, ongoingImpact, newStatus);
    }

    public CrisisInstance withExtendedDeadline(int quarters) {
        return new CrisisInstance(crisisId, instanceId, title, severity, createdQuarter,
            deadlineQuarter + quarters, baseImpact, ongoingImpact, status);
    }

    /** Severity never drops below 1. */
    public CrisisInstance withReducedSeverity(int amount) {
        return new CrisisInstance(crisisId, instanceId, title, Math.max(1, severity - amount), createdQuarter,
            deadlineQuarter, baseImpact, ongoingImpact, status);
    }
}
