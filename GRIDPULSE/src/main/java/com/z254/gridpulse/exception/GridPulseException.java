package com.z254.gridpulse.exception;

/**
 * Base class for GRIDPULSE failures.
 */
public class GridPulseException extends RuntimeException {

    public GridPulseException(String message) {
        super(message);
    }

    public GridPulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
