package com.phillippitts.gatesentry.service.conversation;

/**
 * States of the per-turn conversation machine.
 *
 * <pre>
 * RECEIVE_INPUT → VALIDATE → ROUTE_AFTER_INPUT → RESET | COMPACT | EXTRACT_PROFILE | DECIDE | END
 * COMPACT → EXTRACT_PROFILE → VALIDATE_CONTACT → CHECK_COMPLETENESS → DECIDE | ASK_QUESTION
 * DECIDE → NOTIFY | RESET_FOR_NEXT_VISITOR
 * NOTIFY → RESET_FOR_NEXT_VISITOR → END
 * RESET | ASK_QUESTION → END
 * </pre>
 */
public enum GateState {
    RECEIVE_INPUT,
    VALIDATE,
    ROUTE_AFTER_INPUT,
    RESET,
    COMPACT,
    EXTRACT_PROFILE,
    VALIDATE_CONTACT,
    CHECK_COMPLETENESS,
    ASK_QUESTION,
    DECIDE,
    NOTIFY,
    RESET_FOR_NEXT_VISITOR,
    END
}
