package com.boardroom.sim.exception;

/**
 * A transition the caller should have prevented with a capability query:
 * advancing a finished game, playing a card that is not in hand, playing past
 * the per-quarter cap, choosing an unknown option, sending input that belongs
 * to another phase.
 */
public class IllegalMoveException extends SimulationException {

    public IllegalMoveException(String component, String message) {
        super(component, message);
    }
}
