package com.phillippitts.gatesentry.service.compaction;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.llm.NluClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Replaces the middle of the log with a model-written summary.
 *
 * <p>Result: preamble, one SYSTEM summary, last {@code keep} messages. If the summary call fails or
 * returns nothing the log is left untouched.
 */
public final class SummarizeCompactor implements HistoryCompactor {

    private static final Logger LOG = LogManager.getLogger(SummarizeCompactor.class);

    static final String SUMMARY_PREFIX = "Summary of earlier conversation: ";

    private final NluClient nlu;
    private final int minMessages;
    private final int keep;

    public SummarizeCompactor(NluClient nlu, int minMessages, int keep) {
        this.nlu = Objects.requireNonNull(nlu, "nlu");
        this.minMessages = minMessages;
        this.keep = keep;
    }

    @Override
    public List<ConversationMessage> compact(List<ConversationMessage> messages) {
        int size = messages.size();
        if (size < minMessages || size <= keep + 2) {
            return messages;
        }
        List<ConversationMessage> middle = messages.subList(1, size - keep);
        String transcript = middle.stream().map(ConversationMessage::render).collect(Collectors.joining("\n"));

        String summary;
        try {
            summary = nlu.summarize(transcript);
        } catch (CapabilityException e) {
            LOG.warn("Summarization failed, history kept as-is: {}", e.getMessage());
            return messages;
        }
        if (summary == null || summary.isBlank()) {
            LOG.warn("Summarization returned nothing, history kept as-is");
            return messages;
        }

        List<ConversationMessage> out = new ArrayList<>(keep + 2);
        out.add(messages.get(0));
        out.add(ConversationMessage.system(SUMMARY_PREFIX + summary.trim()));
        out.addAll(messages.subList(size - keep, size));
        LOG.debug("History summarized: {} -> {} messages", size, out.size());
        return out;
    }

    @Override
    public String name() {
        return "summarize";
    }
}
