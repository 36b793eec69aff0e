package com.phillippitts.gatesentry.service.llm;

import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.Base64;
import java.util.Objects;

/**
 * {@link VisionClassifier} that sends the frame inline (base64) to a multimodal chat model.
 */
public final class ChatModelVisionClassifier implements VisionClassifier {

    private final ChatModel model;
    private final GateMetrics metrics;

    public ChatModelVisionClassifier(ChatModel model, GateMetrics metrics) {
        this.model = Objects.requireNonNull(model, "model");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String classify(byte[] image, String mimeType) {
        if (image == null || image.length == 0) {
            throw new CapabilityException("Empty image", LlmRole.VISION.name());
        }
        UserMessage message = UserMessage.from(
                TextContent.from(GatePrompts.vision()),
                ImageContent.from(Base64.getEncoder().encodeToString(image), mimeType));
        long start = System.nanoTime();
        try {
            ChatResponse response = model.chat(message);
            metrics.recordModelCall(LlmRole.VISION, System.nanoTime() - start, true);
            return ModelOutputs.stripThinking(response.aiMessage().text());
        } catch (RuntimeException e) {
            metrics.recordModelCall(LlmRole.VISION, System.nanoTime() - start, false);
            throw new CapabilityException("Image classification failed: " + e.getMessage(), LlmRole.VISION.name(), e);
        }
    }
}
