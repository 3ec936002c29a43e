package com.boardroom.sim.model;

/**
 * Resolved result of a probability-weighted roll.
 */
public enum OutcomeTier {
    GOOD,
    EXPECTED,
    BAD
}
