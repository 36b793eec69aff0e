package com.phillippitts.gatesentry.service.session;

import java.time.Instant;

/**
 * Published after a session has been removed from the store so per-session resources can be released.
 *
 * @param sessionId removed session
 * @param at        removal time
 */
public record SessionEndedEvent(String sessionId, Instant at) {
}
