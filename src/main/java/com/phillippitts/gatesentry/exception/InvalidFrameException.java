package com.phillippitts.gatesentry.exception;

/**
 * Thrown when an uploaded camera frame is missing or cannot be decoded.
 */
public class InvalidFrameException extends GateSentryException {

    private final String reason;

    public InvalidFrameException(String reason) {
        super("Invalid frame: " + reason);
        this.reason = reason;
    }

    public InvalidFrameException(String reason, Throwable cause) {
        super("Invalid frame: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
