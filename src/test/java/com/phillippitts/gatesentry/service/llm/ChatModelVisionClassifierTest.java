package com.phillippitts.gatesentry.service.llm;

import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatModelVisionClassifierTest {

    private ChatModel model;
    private ChatModelVisionClassifier classifier;

    @BeforeEach
    void setUp() {
        model = mock(ChatModel.class);
        classifier = new ChatModelVisionClassifier(model, new GateMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void returnsModelAnswerText() {
        when(model.chat(any(ChatMessage.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"face_detected\": true}"))
                .build());

        assertThat(classifier.classify(new byte[]{1, 2, 3}, "image/jpeg")).isEqualTo("{\"face_detected\": true}");
    }

    @Test
    void emptyImageIsRejectedWithoutCallingModel() {
        assertThatThrownBy(() -> classifier.classify(new byte[0], "image/jpeg"))
                .isInstanceOf(CapabilityException.class);
        verifyNoInteractions(model);
    }

    @Test
    void modelFailureBecomesCapabilityException() {
        when(model.chat(any(ChatMessage.class))).thenThrow(new IllegalStateException("quota"));

        assertThatThrownBy(() -> classifier.classify(new byte[]{1}, "image/png"))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("quota");
    }
}
