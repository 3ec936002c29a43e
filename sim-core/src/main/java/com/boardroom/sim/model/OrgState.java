package com.boardroom.sim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The organization's five health meters, each clamped to [0, 100] on
 * construction so no out-of-range value is ever observable.
 */
public record OrgState(
    @JsonProperty("delivery")   int delivery,
    @JsonProperty("morale")     int morale,
    @JsonProperty("governance") int governance,
    @JsonProperty("alignment")  int alignment,
    @JsonProperty("runway")     int runway
) {

    public static final int MIN_METER = 0;
    public static final int MAX_METER = 100;

    /** Starting value of every meter in a new game. */
    public static final int DEFAULT_METER = 60;

    public OrgState {
        delivery = clamp(delivery);
        morale = clamp(morale);
        governance = clamp(governance);
        alignment = clamp(alignment);
        runway = clamp(runway);
    }

    public static OrgState initial() {
        return new OrgState(DEFAULT_METER, DEFAULT_METER, DEFAULT_METER, DEFAULT_METER, DEFAULT_METER);
    }

    public int getMeter(Meter meter) {
        return switch (meter) {
            case DELIVERY -> delivery;
            case MORALE -> morale;
            case GOVERNANCE -> governance;
            case ALIGNMENT -> alignment;
            case RUNWAY -> runway;
        };
    }

    public OrgState withMeter(Meter meter, int value) {
        return switch (meter) {
            case DELIVERY -> new OrgState(value, morale, governance, alignment, runway);
            case MORALE -> new OrgState(delivery, value, governance, alignment, runway);
            case GOVERNANCE -> new OrgState(delivery, morale, value, alignment, runway);
            case ALIGNMENT -> new OrgState(delivery, morale, governance, value, runway);
            case RUNWAY -> new OrgState(delivery, morale, governance, alignment, value);
        };
    }

    public OrgState withMeterChange(Meter meter, int delta) {
        return withMeter(meter, getMeter(meter) + delta);
    }

    /**
     * Meters ordered by ascending value. Ties keep declaration order.
     */
    public List<Meter> metersByValue() {
        List<Meter> sorted = new ArrayList<>(List.of(Meter.values()));
        sorted.sort((a, b) -> Integer.compare(getMeter(a), getMeter(b)));
        return sorted;
    }

    /** Number of meters strictly below the given threshold. */
    public int countBelow(int threshold) {
        int count = 0;
        for (Meter m : Meter.values()) {
            if (getMeter(m) < threshold) count++;
        }
        return count;
    }

    private static int clamp(int value) {
        return Math.max(MIN_METER, Math.min(MAX_METER, value));
    }
}
