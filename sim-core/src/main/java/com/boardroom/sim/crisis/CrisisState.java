package com.boardroom.sim.crisis;

import com.boardroom.sim.model.Meter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger of crisis instances, active and closed, in creation order.
 */
public record CrisisState(@JsonProperty("crises") List<CrisisInstance> crises) {

    public CrisisState {
        crises = crises == null ? List.of() : List.copyOf(crises);
    }

    public static CrisisState empty() {
        return new CrisisState(List.of());
    }

    /** Result of {@link #processDeadlines(int)}. */
    public record DeadlineResult(CrisisState state, List<CrisisInstance> expired) {}

    public List<CrisisInstance> active() {
        return crises.stream().filter(CrisisInstance::isActive).toList();
    }

    public int activeCount() {
        return active().size();
    }

    /** Deterministic id for the next crisis created in {@code quarter}. */
    public String nextInstanceId(int quarter) {
        return "crisis_" + quarter + "_" + crises.size();
    }

    public CrisisState withCrisisAdded(CrisisInstance crisis) {
        List<CrisisInstance> next = new ArrayList<>(crises);
        next.add(crisis);
        return new CrisisState(next);
    }

    public CrisisState withCrisisUpdated(CrisisInstance updated) {
        return new CrisisState(crises.stream()
            .map(c -> c.instanceId().equals(updated.instanceId()) ? updated : c)
            .toList());
    }

    /** Marks every active crisis past its deadline as expired. */
    public DeadlineResult processDeadlines(int quarter) {
        List<CrisisInstance> updated = new ArrayList<>();
        List<CrisisInstance> expired = new ArrayList<>();
        for (CrisisInstance c : crises) {
            if (c.isActive() && c.isOverdue(quarter)) {
                CrisisInstance e = c.withStatus(CrisisStatus.EXPIRED);
                updated.add(e);
                expired.add(e);
            } else {
                updated.add(c);
            }
        }
        return new DeadlineResult(new CrisisState(updated), List.copyOf(expired));
    }

    /** Summed ongoing impact of active crises, in meter order. */
    public Map<Meter, Integer> totalOngoingImpact() {
        EnumMap<Meter, Integer> totals = new EnumMap<>(Meter.class);
        for (CrisisInstance c : active()) {
            c.ongoingImpact().forEach((meter, delta) -> totals.merge(meter, delta, Integer::sum));
        }
        return Collections.unmodifiableMap(totals);
    }
}
