package com.z254.gridpulse.exception;

/**
 * Text generation was unavailable; callers substitute a templated narrative.
 */
public class NarratorException extends GridPulseException {

    public NarratorException(String message) {
        super(message);
    }

    public NarratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
