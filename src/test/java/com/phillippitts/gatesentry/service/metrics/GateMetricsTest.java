package com.phillippitts.gatesentry.service.metrics;

import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.service.llm.LlmRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GateMetricsTest {

    private SimpleMeterRegistry registry;
    private GateMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GateMetrics(registry);
    }

    @Test
    void decisionsAreTaggedByWireId() {
        metrics.incrementDecision(Decision.CALL_SECURITY);
        metrics.incrementDecision(Decision.CALL_SECURITY);

        assertThat(registry.get("gatesentry.decisions").tag("decision", "call_security").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void modelCallsRecordLatencyByRoleAndOutcome() {
        metrics.recordModelCall(LlmRole.VISION, TimeUnit.MILLISECONDS.toNanos(120), false);

        assertThat(registry.get("gatesentry.model.latency")
                .tag("role", "vision")
                .tag("outcome", "failure")
                .timer()
                .count()).isEqualTo(1);
    }

    @Test
    void extractionMissesAreTaggedByField() {
        metrics.incrementExtractionMiss(ProfileField.CONTACT_PERSON);

        assertThat(registry.get("gatesentry.extraction.miss").tag("field", "contact_person").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void zeroDroppedFramesRegistersNothing() {
        metrics.incrementFramesDropped("superseded", 0);

        assertThat(registry.find("gatesentry.vision.frames.dropped").counter()).isNull();
    }

    @Test
    void visionEventTypesAreLowercased() {
        metrics.incrementVisionEvent("NO_FACE");

        assertThat(registry.get("gatesentry.vision.events").tag("type", "no_face").counter().count())
                .isEqualTo(1.0);
    }
}
