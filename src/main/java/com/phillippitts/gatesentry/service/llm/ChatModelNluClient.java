package com.phillippitts.gatesentry.service.llm;

import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.util.LogSanitizer;
import dev.langchain4j.model.chat.ChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link NluClient} backed by LangChain4j chat models, one per {@link LlmRole}.
 *
 * <p>Each operation is a single-prompt call; the answer is returned with any thinking section removed.
 * Every failure is wrapped in a {@link CapabilityException} naming the role.
 */
public final class ChatModelNluClient implements NluClient {

    private static final Logger LOG = LogManager.getLogger(ChatModelNluClient.class);

    private final Map<LlmRole, ChatModel> models;
    private final GateMetrics metrics;

    public ChatModelNluClient(Map<LlmRole, ChatModel> models, GateMetrics metrics) {
        this.models = new EnumMap<>(Objects.requireNonNull(models, "models"));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String validateInput(String userInput) {
        return call(LlmRole.VALIDATION, GatePrompts.validation(userInput));
    }

    @Override
    public String detectSession(String recentContext, String latestMessage) {
        return call(LlmRole.SESSION, GatePrompts.sessionDetection(recentContext, latestMessage));
    }

    @Override
    public String extractField(ProfileField field, String transcript, List<String> knownContacts) {
        return call(LlmRole.MAIN, GatePrompts.extraction(field, transcript, knownContacts));
    }

    @Override
    public String summarize(String conversation) {
        return call(LlmRole.SUMMARY, GatePrompts.summary(conversation));
    }

    @Override
    public String classifyDecision(String profileSummary, String recentTranscript) {
        return call(LlmRole.DECISION, GatePrompts.decision(profileSummary, recentTranscript));
    }

    private String call(LlmRole role, String prompt) {
        ChatModel model = models.get(role);
        if (model == null) {
            throw new CapabilityException("No model configured", role.name());
        }
        long start = System.nanoTime();
        try {
            String answer = ModelOutputs.stripThinking(model.chat(prompt));
            metrics.recordModelCall(role, System.nanoTime() - start, true);
            LOG.debug("Model {} answered: '{}'", role, LogSanitizer.preview(answer));
            return answer;
        } catch (RuntimeException e) {
            metrics.recordModelCall(role, System.nanoTime() - start, false);
            throw new CapabilityException("Model call failed: " + e.getMessage(), role.name(), e);
        }
    }
}
