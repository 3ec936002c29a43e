package com.boardroom.sim.exception;

/**
 * Raised when a Political Capital spend exceeds the available balance.
 * The state the spend was attempted on is left untouched.
 */
public class InsufficientCapitalException extends SimulationException {
    private final int available;
    private final int required;

    public InsufficientCapitalException(int available, int required) {
        super("ResourceState", "Insufficient Political Capital: have " + available + ", need " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
