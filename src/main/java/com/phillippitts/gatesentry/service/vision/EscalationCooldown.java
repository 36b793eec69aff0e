package com.phillippitts.gatesentry.service.vision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate limit for threat escalations: at most one per session per cooldown period.
 */
final class EscalationCooldown {

    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();

    EscalationCooldown(Duration cooldown, Clock clock) {
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /** Returns {@code true} and starts a new cooldown if the session may escalate now. */
    boolean tryAcquire(String sessionId) {
        Instant now = clock.instant();
        boolean[] acquired = {false};
        lastFired.compute(sessionId, (id, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                acquired[0] = true;
                return now;
            }
            return last;
        });
        return acquired[0];
    }

    void forget(String sessionId) {
        lastFired.remove(sessionId);
    }
}
