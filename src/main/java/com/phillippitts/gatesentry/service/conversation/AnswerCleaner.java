package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.service.llm.ModelOutputs;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalizes a raw extraction answer into a field value.
 *
 * <p>Removes thinking sections, label prefixes and surrounding quotes. Empty answers and the {@code -1}
 * sentinel yield empty. Values keep their last three words, except the contact person which is verbatim.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class AnswerCleaner {

    static final String SENTINEL = "-1";
    private static final int MAX_WORDS = 3;

    private AnswerCleaner() {
    }

    static Optional<String> clean(ProfileField field, String raw) {
        String value = ModelOutputs.stripThinking(raw);
        value = stripPrefixes(field, value);
        value = stripQuotes(value);
        if (value.isEmpty() || SENTINEL.equals(value)) {
            return Optional.empty();
        }
        if (field != ProfileField.CONTACT_PERSON) {
            String[] words = value.split("\\s+");
            if (words.length > MAX_WORDS) {
                value = String.join(" ", Arrays.copyOfRange(words, words.length - MAX_WORDS, words.length));
            }
        }
        return Optional.of(value);
    }

    private static String stripPrefixes(ProfileField field, String value) {
        String label = field.key().replace('_', ' ');
        List<String> prefixes = List.of(
                field.key() + ":",
                label + ":",
                "answer:",
                "response:",
                "value:",
                "result:",
                "the " + label + " is",
                "their " + label + " is");
        String out = value;
        for (String prefix : prefixes) {
            if (out.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                out = out.substring(prefix.length()).trim();
            }
        }
        return out;
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end).trim();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
