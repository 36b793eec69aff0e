package com.phillippitts.gatesentry.service.compaction;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops the middle of the log and leaves a marker. No external calls.
 *
 * <p>Result: preamble, one SYSTEM marker, last {@code keep} messages.
 */
public final class ShortenCompactor implements HistoryCompactor {

    private static final Logger LOG = LogManager.getLogger(ShortenCompactor.class);

    static final String MARKER = "[Earlier conversation shortened: %d messages removed]";

    private final int minMessages;
    private final int keep;

    public ShortenCompactor(int minMessages, int keep) {
        this.minMessages = minMessages;
        this.keep = keep;
    }

    @Override
    public List<ConversationMessage> compact(List<ConversationMessage> messages) {
        int size = messages.size();
        if (size < minMessages || size <= keep + 2) {
            return messages;
        }
        int removed = size - 1 - keep;
        List<ConversationMessage> out = new ArrayList<>(keep + 2);
        out.add(messages.get(0));
        out.add(ConversationMessage.system(MARKER.formatted(removed)));
        out.addAll(messages.subList(size - keep, size));
        LOG.debug("History shortened: {} -> {} messages", size, out.size());
        return out;
    }

    @Override
    public String name() {
        return "shorten";
    }
}
