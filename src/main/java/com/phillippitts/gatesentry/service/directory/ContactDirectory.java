package com.phillippitts.gatesentry.service.directory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of internal contacts by name.
 *
 * <p>Immutable after construction; safe to share across threads.
 */
public final class ContactDirectory {

    private final Map<String, String> emailsByName;

    public ContactDirectory(Map<String, String> emailsByName) {
        this.emailsByName = Collections.unmodifiableMap(new LinkedHashMap<>(emailsByName));
    }

    /**
     * Resolves a spoken contact name to the canonical directory entry.
     * Exact match first, then case-insensitive.
     *
     * @param candidate name as extracted from the conversation
     * @return canonical directory name, or empty if no entry matches
     */
    public Optional<String> match(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String trimmed = candidate.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (emailsByName.containsKey(trimmed)) {
            return Optional.of(trimmed);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String name : emailsByName.keySet()) {
            if (name.toLowerCase(Locale.ROOT).equals(lower)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return name != null && emailsByName.containsKey(name);
    }

    public Optional<String> emailFor(String name) {
        return Optional.ofNullable(name == null ? null : emailsByName.get(name));
    }

    /** Contact names in configuration order. */
    public List<String> names() {
        return List.copyOf(emailsByName.keySet());
    }

    public int size() {
        return emailsByName.size();
    }
}
