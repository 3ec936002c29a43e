package com.boardroom.sim.card;

/**
 * Project card families. Only {@link #REVENUE} cards move quarterly profit.
 */
public enum CardCategory {
    ACTION,
    RESPONSE,
    CORPORATE,
    EMAIL,
    REVENUE
}
