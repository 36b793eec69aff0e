package com.phillippitts.gatesentry.presentation.dto;

import com.phillippitts.gatesentry.service.conversation.TurnOutcome;

/**
 * Result of one turn.
 *
 * @param agentResponse agent lines joined by newlines
 * @param decision      decision identifier, {@code none} when no decision was made this turn
 */
public record MessageResponse(String agentResponse, boolean sessionComplete, String decision, double confidence) {

    public static MessageResponse from(TurnOutcome outcome) {
        return new MessageResponse(outcome.reply(), outcome.sessionComplete(), outcome.decision().id(),
                outcome.confidence());
    }
}
