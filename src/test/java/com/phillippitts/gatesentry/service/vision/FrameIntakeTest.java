package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.exception.InvalidFrameException;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameIntakeTest {

    private static final String PAYLOAD = Base64.getEncoder().encodeToString("jpeg-bytes".getBytes(StandardCharsets.UTF_8));

    private SessionStateStore store;
    private FrameIntake intake;

    @BeforeEach
    void setUp() {
        store = new SessionStateStore();
        store.create("s1", "preamble");
        VisionProperties props = new VisionProperties();
        props.setFrameQueueCapacity(2);
        intake = new FrameIntake(props, store, new GateMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void acceptsPlainBase64() {
        String id = intake.submitBase64("s1", PAYLOAD, null);

        List<CapturedFrame> frames = intake.drainAll();
        assertThat(frames).singleElement().satisfies(f -> {
            assertThat(f.frameId()).isEqualTo(id);
            assertThat(f.mimeType()).isEqualTo("image/jpeg");
            assertThat(new String(f.image(), StandardCharsets.UTF_8)).isEqualTo("jpeg-bytes");
        });
    }

    @Test
    void dataUrlCarriesItsMimeType() {
        intake.submitBase64("s1", "data:image/PNG;base64," + PAYLOAD, "image/jpeg");

        assertThat(intake.drainAll()).singleElement()
                .extracting(CapturedFrame::mimeType)
                .isEqualTo("image/png");
    }

    @Test
    void rejectsBadPayloads() {
        assertThatThrownBy(() -> intake.submitBase64("s1", "  ", null)).isInstanceOf(InvalidFrameException.class);
        assertThatThrownBy(() -> intake.submitBase64("s1", "!!!!", null))
                .isInstanceOf(InvalidFrameException.class);
        assertThat(intake.pending()).isZero();
    }

    @Test
    void rejectsUnknownSession() {
        assertThatThrownBy(() -> intake.submitBase64("nope", PAYLOAD, null))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void overflowDropsOldestFrame() {
        intake.submit("s1", new byte[]{1}, null);
        String second = intake.submit("s1", new byte[]{2}, null);
        String third = intake.submit("s1", new byte[]{3}, null);

        assertThat(intake.droppedCount()).isEqualTo(1);
        assertThat(intake.drainAll()).extracting(CapturedFrame::frameId).containsExactly(second, third);
    }
}
