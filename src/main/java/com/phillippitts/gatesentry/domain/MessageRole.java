package com.phillippitts.gatesentry.domain;

/** Author of a conversation entry. */
public enum MessageRole {
    SYSTEM("system"),
    HUMAN("human"),
    AGENT("agent");

    private final String label;

    MessageRole(String label) {
        this.label = label;
    }

    /** Label used when rendering transcripts for the language model. */
    public String label() {
        return label;
    }
}
