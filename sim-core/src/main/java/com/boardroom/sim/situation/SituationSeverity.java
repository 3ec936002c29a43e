package com.boardroom.sim.situation;

public enum SituationSeverity {
    MINOR,
    MODERATE,
    MAJOR,
    CRITICAL;

    /** One level up; Critical stays Critical. */
    public SituationSeverity escalate() {
        return switch (this) {
            case MINOR -> MODERATE;
            case MODERATE -> MAJOR;
            case MAJOR, CRITICAL -> CRITICAL;
        };
    }

    /** Escalates {@code times} levels, saturating at Critical. */
    public SituationSeverity escalate(int times) {
        SituationSeverity s = this;
        for (int i = 0; i < times; i++) {
            s = s.escalate();
        }
        return s;
    }

    public boolean canDefer() {
        return this != CRITICAL;
    }
}
