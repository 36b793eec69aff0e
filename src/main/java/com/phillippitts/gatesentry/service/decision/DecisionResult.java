package com.phillippitts.gatesentry.service.decision;

import com.phillippitts.gatesentry.domain.Decision;

import java.util.Objects;

/**
 * Outcome of the decision step.
 *
 * @param decision   rendered decision, never {@link Decision#NONE}
 * @param confidence confidence in [0, 1]
 * @param reasoning  short explanation for logs and clients
 * @param message    text spoken to the visitor
 */
public record DecisionResult(Decision decision, double confidence, String reasoning, String message) {

    public DecisionResult {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(message, "message");
        if (decision == Decision.NONE) {
            throw new IllegalArgumentException("A decision result cannot be NONE");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }
}
