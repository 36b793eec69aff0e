package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledFrameCaptureTest {

    @Test
    void capturesOnlyCameraBoundSessions() {
        SessionStateStore store = new SessionStateStore();
        store.create("bound", "preamble");
        store.create("unbound", "preamble");
        store.update("bound", s -> {
            s.setCameraId("front-door");
            return null;
        });
        FrameIntake intake = new FrameIntake(new VisionProperties(), store, new GateMetrics(new SimpleMeterRegistry()));
        FrameSource source = cameraId -> Optional.of(new CapturedImage(new byte[]{1}, "image/jpeg"));

        new ScheduledFrameCapture(store, source, intake).captureRound();

        assertThat(intake.drainAll()).extracting(CapturedFrame::sessionId).containsExactly("bound");
    }

    @Test
    void failingCameraDoesNotStopTheRound() {
        SessionStateStore store = new SessionStateStore();
        store.create("a", "preamble");
        store.update("a", s -> {
            s.setCameraId("broken");
            return null;
        });
        FrameIntake intake = new FrameIntake(new VisionProperties(), store, new GateMetrics(new SimpleMeterRegistry()));
        FrameSource source = cameraId -> {
            throw new IllegalStateException("camera offline");
        };

        new ScheduledFrameCapture(store, source, intake).captureRound();

        assertThat(intake.pending()).isZero();
    }
}
