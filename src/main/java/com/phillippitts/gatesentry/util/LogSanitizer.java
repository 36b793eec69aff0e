package com.phillippitts.gatesentry.util;

/** Utility for privacy-safe logging of visitor text and model answers. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /** Default preview length for visitor-supplied text. */
    public static final int PREVIEW = 60;

    /**
     * Truncate the input string to at most max characters and fold line breaks; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String single = s.replace('\r', ' ').replace('\n', ' ');
        return single.length() <= max ? single : single.substring(0, max) + "...";
    }

    /** Truncates to {@link #PREVIEW} characters. */
    public static String preview(String s) {
        return truncate(s, PREVIEW);
    }
}
