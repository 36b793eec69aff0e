package com.phillippitts.gatesentry.service.health;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.vision.FrameIntake;
import com.phillippitts.gatesentry.service.vision.VisionConsumer;
import com.phillippitts.gatesentry.service.vision.VisionPipeline;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Health indicator for the vision pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: consumer thread running</li>
 *   <li>UNKNOWN: vision disabled by configuration</li>
 *   <li>DOWN: vision enabled but the consumer is not running</li>
 * </ul>
 *
 * <p>Queue depths and drop counters are included as details. Exposed via /actuator/health.
 */
@Component
public class VisionPipelineHealthIndicator implements HealthIndicator {

    private final VisionConsumer consumer;
    private final VisionPipeline pipeline;
    private final FrameIntake intake;
    private final StateBridge bridge;
    private final VisionProperties props;

    public VisionPipelineHealthIndicator(VisionConsumer consumer,
                                         VisionPipeline pipeline,
                                         FrameIntake intake,
                                         StateBridge bridge,
                                         VisionProperties props) {
        this.consumer = consumer;
        this.pipeline = pipeline;
        this.intake = intake;
        this.bridge = bridge;
        this.props = props;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        if (!props.isEnabled()) {
            builder = Health.unknown().withDetail("status", "disabled");
        } else if (consumer.isRunning()) {
            builder = Health.up().withDetail("status", "Vision consumer running");
        } else {
            builder = Health.down().withDetail("status", "Vision consumer not running");
        }
        Instant last = pipeline.lastProcessedAt();
        return builder
                .withDetail("pendingFrames", intake.pending())
                .withDetail("droppedFrames", intake.droppedCount())
                .withDetail("pendingBridgeUpdates", bridge.pending())
                .withDetail("droppedBridgeUpdates", bridge.droppedCount())
                .withDetail("lastProcessedAt", last == null ? "never" : last.toString())
                .build();
    }
}
