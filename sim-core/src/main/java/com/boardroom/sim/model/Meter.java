package com.boardroom.sim.model;

/**
 * The five organizational health meters. Declaration order is the canonical
 * order used for iteration and tie-breaking.
 */
public enum Meter {
    DELIVERY,
    MORALE,
    GOVERNANCE,
    ALIGNMENT,
    RUNWAY
}
