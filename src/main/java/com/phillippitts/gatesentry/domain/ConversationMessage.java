package com.phillippitts.gatesentry.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One role-tagged entry of a session's message log.
 *
 * @param role    author of the entry
 * @param content text content (never null)
 * @param at      when the entry was created
 */
public record ConversationMessage(MessageRole role, String content, Instant at) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        if (at == null) {
            at = Instant.now();
        }
    }

    public static ConversationMessage system(String content) {
        return new ConversationMessage(MessageRole.SYSTEM, content, Instant.now());
    }

    public static ConversationMessage human(String content) {
        return new ConversationMessage(MessageRole.HUMAN, content, Instant.now());
    }

    public static ConversationMessage agent(String content) {
        return new ConversationMessage(MessageRole.AGENT, content, Instant.now());
    }

    /** Renders the entry as {@code role: content} for transcripts. */
    public String render() {
        return role.label() + ": " + content;
    }
}
