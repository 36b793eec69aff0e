package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.service.session.SessionStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Timer-driven frame producer: captures one frame per camera-bound session each round.
 *
 * <p>Enabled with {@code gate.vision.capture.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "gate.vision.capture", name = "enabled", havingValue = "true")
public class ScheduledFrameCapture {

    private static final Logger LOG = LogManager.getLogger(ScheduledFrameCapture.class);

    private final SessionStateStore store;
    private final FrameSource source;
    private final FrameIntake intake;

    public ScheduledFrameCapture(SessionStateStore store, FrameSource source, FrameIntake intake) {
        this.store = store;
        this.source = source;
        this.intake = intake;
        LOG.info("Scheduled frame capture enabled");
    }

    @Scheduled(fixedDelayString = "${gate.vision.capture.interval-ms:2000}")
    public void captureRound() {
        Map<String, String> bindings = store.cameraBindings();
        bindings.forEach((sessionId, cameraId) -> {
            try {
                source.capture(cameraId).ifPresent(img -> intake.submit(sessionId, img.data(), img.mimeType()));
            } catch (RuntimeException e) {
                LOG.warn("Capture from camera {} failed: {}", cameraId, e.getMessage());
            }
        });
    }
}
