package com.phillippitts.gatesentry.service.conversation;

/** Branch chosen after a visitor line has been received and validated. */
public enum Route {
    /** Input was rejected; nothing else happens this turn. */
    END,
    /** Session inactive or a new visitor: start over with the current line. */
    RESET,
    /** High visual threat: skip intake and decide immediately. */
    SECURITY,
    /** Too many visitor lines: compact history before extracting. */
    COMPACT,
    /** Normal intake. */
    EXTRACT
}
