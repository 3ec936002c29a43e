package com.boardroom.sim.exception;

/**
 * Base unchecked exception for the simulation core. The message is prefixed
 * with the name of the component that rejected the operation.
 */
public class SimulationException extends RuntimeException {
    private final String component;

    public SimulationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SimulationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
