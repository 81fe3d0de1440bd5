package com.z254.gridpulse.exception;

/**
 * The primary metric series could not be obtained. Fails the task.
 */
public class StructuralFetchException extends GridPulseException {

    public StructuralFetchException(String message) {
        super(message);
    }

    public StructuralFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
