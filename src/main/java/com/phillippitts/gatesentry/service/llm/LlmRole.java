package com.phillippitts.gatesentry.service.llm;

/** Model roles, each with its own model id and temperature. */
public enum LlmRole {
    MAIN, VALIDATION, SESSION, SUMMARY, DECISION, VISION
}
