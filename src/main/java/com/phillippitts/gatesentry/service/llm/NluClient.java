package com.phillippitts.gatesentry.service.llm;

import com.phillippitts.gatesentry.domain.ProfileField;

import java.util.List;

/**
 * Language capability used by the conversation state machine.
 *
 * <p>Every method returns the model's raw answer (thinking sections already removed); interpretation
 * and fallbacks belong to the caller. Implementations throw
 * {@link com.phillippitts.gatesentry.exception.CapabilityException} on transport failure or timeout.
 */
public interface NluClient {

    /**
     * Classifies whether a visitor line is relevant to a checkpoint conversation.
     * Expected answer: {@code valid} or {@code unrelated}.
     */
    String validateInput(String userInput);

    /**
     * Judges whether the latest line comes from a new visitor.
     * Expected answer: {@code new} or {@code same}.
     */
    String detectSession(String recentContext, String latestMessage);

    /**
     * Extracts one profile field from the transcript. Expected answer: the value, or {@code -1}.
     *
     * @param knownContacts directory names, offered to the model when extracting the contact person
     */
    String extractField(ProfileField field, String transcript, List<String> knownContacts);

    /** Summarizes older conversation lines into a short paragraph. */
    String summarize(String conversation);

    /**
     * Classifies the access decision. Expected answer: a JSON object
     * {@code {"decision": ..., "confidence": ..., "reasoning": ...}}.
     */
    String classifyDecision(String profileSummary, String recentTranscript);
}
