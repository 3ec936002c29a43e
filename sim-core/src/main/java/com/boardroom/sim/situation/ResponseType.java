package com.boardroom.sim.situation;

/**
 * The four ways of answering a situation. Every situation offers exactly one
 * response of each type.
 */
public enum ResponseType {
    /** Spend Political Capital for better odds. */
    PC,
    /** Standard roll. */
    RISK,
    /** Ethically questionable tactics; raises the evil score. */
    EVIL,
    /** Put it aside; may return escalated. */
    DEFER
}
