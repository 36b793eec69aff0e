package com.phillippitts.gatesentry.config;

import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.service.compaction.HistoryCompactor;
import com.phillippitts.gatesentry.service.compaction.ShortenCompactor;
import com.phillippitts.gatesentry.service.compaction.SummarizeCompactor;
import com.phillippitts.gatesentry.service.llm.NluClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the history compaction strategy from {@code gate.conversation.history-mode}.
 */
@Configuration
public class ConversationConfig {

    private static final Logger LOG = LogManager.getLogger(ConversationConfig.class);

    @Bean
    public HistoryCompactor historyCompactor(ConversationProperties props, NluClient nlu) {
        ConversationProperties.Compaction c = props.getCompaction();
        HistoryCompactor compactor = switch (props.getHistoryMode()) {
            case SHORTEN -> new ShortenCompactor(c.getMinMessages(), c.getShortenKeep());
            case SUMMARIZE -> new SummarizeCompactor(nlu, c.getMinMessages(), c.getSummarizeKeep());
        };
        LOG.info("History compaction: {} (min-messages={})", compactor.name(), c.getMinMessages());
        return compactor;
    }
}
