package com.phillippitts.gatesentry.presentation.exception;

import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.exception.InvalidFrameException;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.exception.TurnInProgressException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void sessionNotFoundReturns404WithErrorCode() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("s1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("SessionNotFoundException").contains("Session not found");
    }

    @Test
    void turnInProgressReturns409() {
        ResponseEntity<?> response = handler.handleTurnInProgress(new TurnInProgressException("s1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("try again");
    }

    @Test
    void invalidFrameReturns400WithoutLeakingReason() {
        ResponseEntity<?> response = handler.handleInvalidFrame(new InvalidFrameException("decodes to zero bytes"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("reposition").doesNotContain("zero bytes");
    }

    @Test
    void capabilityOutageReturns503() {
        ResponseEntity<?> response = handler.handleCapability(new CapabilityException("timeout", "vision"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("CapabilityException");
    }

    @Test
    void unexpectedErrorReturns500WithGenericCode() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError").doesNotContain("secret detail");
    }
}
