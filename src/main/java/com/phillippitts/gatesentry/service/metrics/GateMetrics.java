package com.phillippitts.gatesentry.service.metrics;

import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.service.llm.LlmRole;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the gate: conversation turns, model calls, decisions, the vision pipeline
 * and the state bridge.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class GateMetrics {

    private static final String PREFIX = "gatesentry";

    private final MeterRegistry registry;

    public GateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency and outcome of one model call.
     *
     * @param role          model role that served the call
     * @param durationNanos duration in nanoseconds
     * @param success       whether the call returned an answer
     */
    public void recordModelCall(LlmRole role, long durationNanos, boolean success) {
        Timer.builder(PREFIX + ".model.latency")
                .description("Time taken by language and vision model calls")
                .tag("role", tag(role.name()))
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Records the wall time of one conversation turn. */
    public void recordTurn(long durationNanos) {
        Timer.builder(PREFIX + ".turn.latency")
                .description("Time taken to run one conversation turn")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementDecision(Decision decision) {
        Counter.builder(PREFIX + ".decisions")
                .description("Access decisions rendered")
                .tag("decision", decision.id())
                .register(registry)
                .increment();
    }

    public void incrementExtractionMiss(ProfileField field) {
        Counter.builder(PREFIX + ".extraction.miss")
                .description("Field extractions that produced no usable value")
                .tag("field", field.key())
                .register(registry)
                .increment();
    }

    public void incrementNotification(boolean success) {
        Counter.builder(PREFIX + ".notifications")
                .description("Contact notifications attempted")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Counts discarded frames.
     *
     * @param reason {@code overflow} (evicted from a full queue) or {@code superseded} (a newer frame won)
     */
    public void incrementFramesDropped(String reason, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(PREFIX + ".vision.frames.dropped")
                .description("Camera frames discarded before analysis")
                .tag("reason", reason)
                .register(registry)
                .increment(count);
    }

    public void incrementFramesAnalysed(boolean classifierSucceeded) {
        Counter.builder(PREFIX + ".vision.frames.analysed")
                .description("Camera frames analysed")
                .tag("outcome", classifierSucceeded ? "success" : "fallback")
                .register(registry)
                .increment();
    }

    /** Counts gate events raised by the vision pipeline ({@code no_face}, {@code threat_escalation}). */
    public void incrementVisionEvent(String type) {
        Counter.builder(PREFIX + ".vision.events")
                .description("Events raised by the vision pipeline")
                .tag("type", tag(type))
                .register(registry)
                .increment();
    }

    /**
     * Counts state bridge outcomes.
     *
     * @param outcome {@code applied}, {@code retried}, {@code abandoned}, {@code unknown_session} or {@code overflow}
     */
    public void incrementBridge(String outcome) {
        Counter.builder(PREFIX + ".bridge.requests")
                .description("State bridge update requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    private static String tag(String raw) {
        return raw.toLowerCase(Locale.ROOT);
    }
}
