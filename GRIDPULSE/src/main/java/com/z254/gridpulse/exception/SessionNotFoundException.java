package com.z254.gridpulse.exception;

/**
 * No session exists for the id, or it has expired.
 */
public class SessionNotFoundException extends GridPulseException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
