package com.phillippitts.gatesentry.service.llm;

import java.util.Optional;

/**
 * Helpers for cleaning raw model answers.
 */
public final class ModelOutputs {

    private static final String THINK_OPEN = "<think>";
    private static final String THINK_CLOSE = "</think>";

    private ModelOutputs() {
    }

    /**
     * Drops a reasoning-model {@code <think>...</think>} preamble and trims the rest.
     * Returns "" for null.
     */
    public static String stripThinking(String raw) {
        if (raw == null) {
            return "";
        }
        int open = raw.indexOf(THINK_OPEN);
        if (open >= 0) {
            int close = raw.indexOf(THINK_CLOSE, open);
            if (close >= 0) {
                return raw.substring(close + THINK_CLOSE.length()).trim();
            }
        }
        return raw.trim();
    }

    /**
     * Returns the outermost {@code {...}} block of the text, tolerating prose or code fences around it.
     */
    public static Optional<String> firstJsonObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }
}
