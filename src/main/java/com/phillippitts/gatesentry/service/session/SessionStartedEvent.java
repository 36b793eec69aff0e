package com.phillippitts.gatesentry.service.session;

import java.time.Instant;

/**
 * Published after a session has been created in the store.
 *
 * @param sessionId new session
 * @param at        creation time
 */
public record SessionStartedEvent(String sessionId, Instant at) {
}
