package com.phillippitts.gatesentry.exception;

/**
 * Thrown when a turn is submitted for a session that is already processing one.
 * Callers are expected to serialize turns per session; this is the guard when they do not.
 */
public class TurnInProgressException extends GateSentryException {

    private final String sessionId;

    public TurnInProgressException(String sessionId) {
        super("A turn is already in progress for session " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
