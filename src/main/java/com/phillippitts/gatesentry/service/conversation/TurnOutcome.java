package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.Decision;

import java.util.List;

/**
 * Result of one conversation turn, captured before any end-of-cycle reset.
 *
 * @param replies         agent lines produced this turn, in order
 * @param sessionComplete a decision cycle finished and the session was reset
 * @param decision        decision rendered this turn, or {@link Decision#NONE}
 * @param confidence      confidence of that decision (0 when none)
 */
public record TurnOutcome(List<String> replies, boolean sessionComplete, Decision decision, double confidence) {

    public TurnOutcome {
        replies = List.copyOf(replies);
    }

    /** All replies joined for single-message transports. */
    public String reply() {
        return String.join("\n", replies);
    }
}
