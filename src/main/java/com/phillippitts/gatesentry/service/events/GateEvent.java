package com.phillippitts.gatesentry.service.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Event raised by the vision pipeline or the state bridge for one session.
 *
 * @param type      event kind
 * @param sessionId target session
 * @param message   human-readable payload (agent line or event details)
 * @param at        creation time
 */
public record GateEvent(GateEventType type, String sessionId, String message, Instant at) {

    public GateEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sessionId, "sessionId");
        message = message == null ? "" : message;
        at = at == null ? Instant.now() : at;
    }

    public static GateEvent of(GateEventType type, String sessionId, String message) {
        return new GateEvent(type, sessionId, message, Instant.now());
    }
}
