package com.phillippitts.gatesentry.service.health;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.vision.FrameIntake;
import com.phillippitts.gatesentry.service.vision.VisionConsumer;
import com.phillippitts.gatesentry.service.vision.VisionPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VisionPipelineHealthIndicatorTest {

    private VisionConsumer consumer;
    private VisionPipeline pipeline;
    private FrameIntake intake;
    private StateBridge bridge;
    private VisionProperties props;
    private VisionPipelineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        consumer = mock(VisionConsumer.class);
        pipeline = mock(VisionPipeline.class);
        intake = mock(FrameIntake.class);
        bridge = mock(StateBridge.class);
        props = new VisionProperties();
        indicator = new VisionPipelineHealthIndicator(consumer, pipeline, intake, bridge, props);
    }

    @Test
    void upWhenConsumerRunning() {
        when(consumer.isRunning()).thenReturn(true);
        when(intake.pending()).thenReturn(2);
        when(bridge.droppedCount()).thenReturn(5L);
        when(pipeline.lastProcessedAt()).thenReturn(Instant.parse("2024-05-01T10:00:00Z"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("pendingFrames", 2)
                .containsEntry("droppedBridgeUpdates", 5L)
                .containsEntry("lastProcessedAt", "2024-05-01T10:00:00Z");
    }

    @Test
    void downWhenEnabledButNotRunning() {
        when(consumer.isRunning()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("lastProcessedAt", "never");
    }

    @Test
    void unknownWhenDisabled() {
        props.setEnabled(false);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }
}
