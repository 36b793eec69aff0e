package com.phillippitts.gatesentry.config.llm;

import com.phillippitts.gatesentry.config.properties.LlmProperties;
import com.phillippitts.gatesentry.service.llm.ChatModelNluClient;
import com.phillippitts.gatesentry.service.llm.ChatModelVisionClassifier;
import com.phillippitts.gatesentry.service.llm.LlmRole;
import com.phillippitts.gatesentry.service.llm.NluClient;
import com.phillippitts.gatesentry.service.llm.VisionClassifier;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the model-backed capabilities. One {@link ChatModel} is built per role so each can use its own
 * model id and temperature against the same OpenAI-compatible endpoint.
 *
 * <p>Both beans back off when another implementation is present (tests, alternative adapters).
 */
@Configuration
public class LlmClientConfig {

    private static final Logger LOG = LogManager.getLogger(LlmClientConfig.class);

    @Bean
    @ConditionalOnMissingBean(NluClient.class)
    public NluClient nluClient(LlmProperties props, GateMetrics metrics) {
        Map<LlmRole, ChatModel> models = new EnumMap<>(LlmRole.class);
        models.put(LlmRole.MAIN, chatModel(props, props.getMain()));
        models.put(LlmRole.VALIDATION, chatModel(props, props.getValidation()));
        models.put(LlmRole.SESSION, chatModel(props, props.getSession()));
        models.put(LlmRole.SUMMARY, chatModel(props, props.getSummary()));
        models.put(LlmRole.DECISION, chatModel(props, props.getDecision()));
        LOG.info("Language models configured at {} (main={}, decision={})",
                props.getBaseUrl(), props.getMain().getModelName(), props.getDecision().getModelName());
        return new ChatModelNluClient(models, metrics);
    }

    @Bean
    @ConditionalOnMissingBean(VisionClassifier.class)
    public VisionClassifier visionClassifier(LlmProperties props, GateMetrics metrics) {
        LOG.info("Vision model configured: {}", props.getVision().getModelName());
        return new ChatModelVisionClassifier(chatModel(props, props.getVision()), metrics);
    }

    static ChatModel chatModel(LlmProperties props, LlmProperties.ModelSettings settings) {
        return OpenAiChatModel.builder()
                .baseUrl(props.getBaseUrl())
                .apiKey(props.getApiKey())
                .modelName(settings.getModelName())
                .temperature(settings.getTemperature())
                .timeout(props.getTimeout())
                .build();
    }
}
