package com.phillippitts.gatesentry.service.compaction;

import com.phillippitts.gatesentry.domain.ConversationMessage;

import java.util.List;

/**
 * Shrinks a conversation log while keeping the preamble and the most recent exchange.
 *
 * <p>Contract: the first element of both input and output is the system preamble. Below the configured
 * minimum size the input is returned unchanged; otherwise the output is strictly shorter than the input
 * or, when compaction is not possible, the input itself.
 */
public interface HistoryCompactor {

    List<ConversationMessage> compact(List<ConversationMessage> messages);

    /** Short name used in logs. */
    String name();
}
