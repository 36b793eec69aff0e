package com.phillippitts.gatesentry.domain;

import java.util.Locale;

/** Threat level reported by image classification. */
public enum ThreatLevel {
    LOW, MEDIUM, HIGH;

    /** Lenient parse; anything unrecognised is LOW. */
    public static ThreatLevel parse(String raw) {
        if (raw == null) {
            return LOW;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }
}
