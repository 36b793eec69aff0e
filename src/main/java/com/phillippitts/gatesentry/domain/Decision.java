package com.phillippitts.gatesentry.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Access decision rendered at the end of a screening cycle.
 */
public enum Decision {
    NONE("none"),
    ALLOW_REQUEST("allow_request"),
    CALL_SECURITY("call_security"),
    DENY_REQUEST("deny_request");

    private final String id;

    Decision(String id) {
        this.id = id;
    }

    /** Identifier used by the classification capability and API clients. */
    public String id() {
        return id;
    }

    /**
     * Parses a decision identifier. {@code none} is not a valid classifier answer and is rejected.
     */
    public static Optional<Decision> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Decision d : values()) {
            if (d != NONE && d.id.equals(normalized)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
