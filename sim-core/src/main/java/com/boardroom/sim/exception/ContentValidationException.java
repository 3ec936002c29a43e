package com.boardroom.sim.exception;

public class ContentValidationException extends SimulationException {

    public ContentValidationException(String component, String message) {
        super(component, message);
    }

    public ContentValidationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
