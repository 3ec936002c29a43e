package com.boardroom.sim.log;

/**
 * Tag of a {@link LogEntry}. Presentation layers choose how to render each.
 */
public enum LogCategory {
    INFO,
    METER_CHANGE,
    EVENT,
    OUTCOME
}
