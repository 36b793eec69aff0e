package com.phillippitts.gatesentry.exception;

/**
 * Thrown when an operation names a session id the store does not know.
 */
public class SessionNotFoundException extends GateSentryException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
