package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.config.properties.VisionLogProperties;
import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.events.GateEvent;
import com.phillippitts.gatesentry.service.events.GateEventQueue;
import com.phillippitts.gatesentry.service.events.GateEventType;
import com.phillippitts.gatesentry.service.log.VisionLogStore;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.session.SessionEndedEvent;
import com.phillippitts.gatesentry.service.session.SessionStartedEvent;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import com.phillippitts.gatesentry.testutil.FakeVisionClassifier;
import com.phillippitts.gatesentry.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VisionPipelineTest {

    private static final String SESSION = "s1";

    @TempDir
    Path logDir;

    private SessionStateStore store;
    private GateEventQueue events;
    private StateBridge bridge;
    private VisionLogStore visionLog;
    private FakeVisionClassifier classifier;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private VisionPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new SessionStateStore();
        store.create(SESSION, "preamble");
        BridgeProperties bridgeProps = new BridgeProperties();
        registry = new SimpleMeterRegistry();
        GateMetrics metrics = new GateMetrics(registry);
        events = new GateEventQueue(bridgeProps);
        bridge = new StateBridge(store, events, bridgeProps, metrics);
        VisionLogProperties logProps = new VisionLogProperties();
        logProps.setDirectory(logDir.toString());
        visionLog = new VisionLogStore(logProps);
        classifier = new FakeVisionClassifier();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        pipeline = new VisionPipeline(classifier, bridge, events, visionLog, new VisionProperties(), metrics, clock);
        pipeline.onSessionStarted(new SessionStartedEvent(SESSION, clock.instant()));
    }

    private void frames(String answer, int count) {
        classifier.answer(answer);
        for (int i = 0; i < count; i++) {
            pipeline.process(new CapturedFrame("f" + i, SESSION, new byte[]{1}, "image/jpeg", clock.instant()));
            clock.advance(Duration.ofMillis(500));
        }
    }

    @Test
    void absentVisitorDeactivatesSessionOnce() {
        frames(FakeVisionClassifier.FACE, 1);
        assertThat(visionLog.entries(SESSION)).hasSize(1);

        frames(FakeVisionClassifier.NO_FACE, 4);
        bridge.drainOnce();

        assertThat(store.snapshot(SESSION).isSessionActive()).isFalse();
        assertThat(visionLog.entries(SESSION)).isEmpty();

        frames(FakeVisionClassifier.NO_FACE, 10);
        bridge.drainOnce();
        bridge.drainOnce();

        List<GateEvent> raised = events.pollBatch(100);
        assertThat(raised).extracting(GateEvent::type)
                .containsExactly(GateEventType.NO_FACE, GateEventType.AGENT_MESSAGE);
        assertThat(raised.get(1).message()).isEqualTo(new BridgeProperties().getFarewell());
        assertThat(visionLog.entries(SESSION)).isEmpty();
    }

    @Test
    void returningFaceReactivatesSessionWithGreeting() {
        frames(FakeVisionClassifier.NO_FACE, 4);
        bridge.drainOnce();
        events.pollBatch(100);

        frames(FakeVisionClassifier.FACE, 1);
        bridge.drainOnce();

        assertThat(store.snapshot(SESSION).isSessionActive()).isTrue();
        assertThat(events.pollBatch(100)).singleElement()
                .extracting(GateEvent::message)
                .isEqualTo(new BridgeProperties().getGreeting());
    }

    @Test
    void verdictReachesSessionThroughBridgeOnly() {
        frames(FakeVisionClassifier.FACE, 1);
        assertThat(store.snapshot(SESSION).getVisionSchema()).isNull();

        bridge.drainOnce();

        assertThat(store.snapshot(SESSION).getVisionSchema().details()).isEqualTo("person at door");
    }

    @Test
    void threatEscalationIsRateLimited() {
        frames(FakeVisionClassifier.WEAPON, 3);

        assertThat(events.pollBatch(100)).extracting(GateEvent::type)
                .containsExactly(GateEventType.THREAT_ESCALATION);

        clock.advance(Duration.ofSeconds(10));
        frames(FakeVisionClassifier.WEAPON, 1);

        assertThat(events.pollBatch(100)).singleElement()
                .satisfies(e -> assertThat(e.message()).isEqualTo("knife visible"));
        assertThat(visionLog.entries(SESSION)).hasSize(4);
    }

    @Test
    void classifierOutageCountsAsNoFace() {
        classifier.failing(true);

        frames(FakeVisionClassifier.FACE, 4);

        assertThat(events.pollBatch(100)).extracting(GateEvent::type).containsExactly(GateEventType.NO_FACE);
        assertThat(registry.get("gatesentry.vision.frames.analysed").tag("outcome", "fallback").counter().count())
                .isEqualTo(4.0);
        assertThat(pipeline.lastProcessedAt()).isNotNull();
    }

    @Test
    void endedSessionForgetsItsWindow() {
        frames(FakeVisionClassifier.NO_FACE, 3);

        pipeline.onSessionEnded(new SessionEndedEvent(SESSION, Instant.now()));
        frames(FakeVisionClassifier.NO_FACE, 1);

        assertThat(events.pollBatch(100)).isEmpty();
    }

    @Test
    void frameArrivingAfterSessionEndLeavesNoTrace() {
        frames(FakeVisionClassifier.FACE, 1);
        SessionEndedEvent ended = new SessionEndedEvent(SESSION, clock.instant());
        visionLog.onSessionEnded(ended);
        pipeline.onSessionEnded(ended);

        frames(FakeVisionClassifier.WEAPON, 1);

        assertThat(Files.exists(logDir.resolve(SESSION + ".json"))).isFalse();
        assertThat(visionLog.entries(SESSION)).isEmpty();
        assertThat(events.pollBatch(100)).isEmpty();
    }

    @Test
    void frameForUnknownSessionIsDiscarded() {
        classifier.answer(FakeVisionClassifier.WEAPON);

        pipeline.process(new CapturedFrame("f0", "ghost", new byte[]{1}, "image/jpeg", clock.instant()));

        assertThat(Files.exists(logDir.resolve("ghost.json"))).isFalse();
        assertThat(events.pollBatch(100)).isEmpty();
        assertThat(bridge.pending()).isZero();
    }
}
