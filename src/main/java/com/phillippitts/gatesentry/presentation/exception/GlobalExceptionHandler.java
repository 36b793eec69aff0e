package com.phillippitts.gatesentry.presentation.exception;

import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.exception.InvalidFrameException;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.exception.TurnInProgressException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Messages shown to clients are retry, reposition or wait prompts; details stay in the logs.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown or ended session (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found",
                "Start a new session and try again.");
    }

    /**
     * Another turn for the same session is still running (HTTP 409).
     */
    @ExceptionHandler(TurnInProgressException.class)
    ResponseEntity<ApiError> handleTurnInProgress(TurnInProgressException ex) {
        LOG.info("Rejected concurrent turn for session {}", ex.getSessionId());
        return error(HttpStatus.CONFLICT, ex, "Still answering your previous message",
                "Please wait a moment and try again.");
    }

    /**
     * Client error - unusable image (HTTP 400).
     */
    @ExceptionHandler(InvalidFrameException.class)
    ResponseEntity<ApiError> handleInvalidFrame(InvalidFrameException ex) {
        LOG.warn("Invalid frame: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid image",
                "Please reposition the camera and send the image again.");
    }

    /**
     * Client error - malformed or incomplete request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request",
                "Please check the request and try again.");
    }

    /**
     * Collaborator outage that escaped its call site (HTTP 503).
     */
    @ExceptionHandler(CapabilityException.class)
    ResponseEntity<ApiError> handleCapability(CapabilityException ex) {
        LOG.error("Capability {} unavailable", ex.getCapability(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Service temporarily unavailable",
                "Please retry in a few seconds.");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please wait a moment and try again.",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
