package com.phillippitts.gatesentry.exception;

/**
 * Base exception for all gate-sentry application errors.
 * Domain exceptions extend this class so the REST boundary can translate them centrally.
 */
public class GateSentryException extends RuntimeException {

    public GateSentryException(String message) {
        super(message);
    }

    public GateSentryException(String message, Throwable cause) {
        super(message, cause);
    }

    public GateSentryException(Throwable cause) {
        super(cause);
    }
}
