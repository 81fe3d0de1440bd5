package com.z254.gridpulse.exception;

/**
 * The query could not be classified, or named a region that cannot be resolved. Fails the task.
 */
public class ClassificationException extends GridPulseException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
