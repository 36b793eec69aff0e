package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.bridge.StateUpdateRequest;
import com.phillippitts.gatesentry.service.events.GateEvent;
import com.phillippitts.gatesentry.service.events.GateEventQueue;
import com.phillippitts.gatesentry.service.events.GateEventType;
import com.phillippitts.gatesentry.service.llm.VisionClassifier;
import com.phillippitts.gatesentry.service.log.VisionLogStore;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.session.SessionEndedEvent;
import com.phillippitts.gatesentry.service.session.SessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analyses one retained frame and turns the verdict into state updates and gate events.
 *
 * <p>Per frame: classify (falling back to the no-face default), push the face flag into the session's
 * detection window, then
 * <ul>
 *   <li>window full and all absent: submit {@code session_active=false}, clear the vision log and, on
 *       the transition only, raise NO_FACE</li>
 *   <li>otherwise: submit the verdict ({@code session_active=true} when a face is visible) and append it
 *       to the vision log</li>
 *   <li>high threat with a dangerous object: raise THREAT_ESCALATION, rate limited per session</li>
 * </ul>
 *
 * <p>Never touches the session store directly; all state changes go through the {@link StateBridge}.
 * Live sessions are tracked from session start/end events, and frames for any other id are discarded
 * without leaving per-session state behind.
 * {@link #process(CapturedFrame)} is only called from the vision consumer thread.
 */
@Component
public class VisionPipeline {

    private static final Logger LOG = LogManager.getLogger(VisionPipeline.class);

    private final VisionClassifier classifier;
    private final StateBridge bridge;
    private final GateEventQueue events;
    private final VisionLogStore visionLog;
    private final GateMetrics metrics;
    private final Clock clock;
    private final int windowSize;
    private final EscalationCooldown cooldown;
    private final Map<String, FaceDetectionWindow> windows = new ConcurrentHashMap<>();
    private final Set<String> liveSessions = ConcurrentHashMap.newKeySet();
    private volatile Instant lastProcessedAt;

    public VisionPipeline(VisionClassifier classifier,
                          StateBridge bridge,
                          GateEventQueue events,
                          VisionLogStore visionLog,
                          VisionProperties props,
                          GateMetrics metrics,
                          Clock clock) {
        this.classifier = classifier;
        this.bridge = bridge;
        this.events = events;
        this.visionLog = visionLog;
        this.metrics = metrics;
        this.clock = clock;
        this.windowSize = props.getWindowSize();
        this.cooldown = new EscalationCooldown(props.getEscalationCooldown(), clock);
    }

    public void process(CapturedFrame frame) {
        String sessionId = frame.sessionId();
        ThreadContext.put("sessionId", sessionId);
        try {
            if (!liveSessions.contains(sessionId)) {
                LOG.debug("Frame {} belongs to no live session; discarded", frame.frameId());
                return;
            }
            VisionSchema schema = classify(frame);
            // the session may have ended while the classifier was running
            if (!liveSessions.contains(sessionId)) {
                LOG.debug("Session ended during analysis of frame {}; verdict discarded", frame.frameId());
                return;
            }
            FaceDetectionWindow window = windows.computeIfAbsent(sessionId, id -> new FaceDetectionWindow(windowSize));
            boolean enteredAbsent = window.push(schema.faceDetected());

            if (window.isAllAbsent()) {
                bridge.submit(StateUpdateRequest.vision(sessionId, schema, false));
                visionLog.clear(sessionId);
                if (enteredAbsent) {
                    LOG.info("No face in the last {} frames", windowSize);
                    metrics.incrementVisionEvent(GateEventType.NO_FACE.name());
                    events.offer(GateEvent.of(GateEventType.NO_FACE, sessionId,
                            "No face detected in the last " + windowSize + " frames"));
                }
            } else {
                bridge.submit(StateUpdateRequest.vision(sessionId, schema, schema.faceDetected() ? Boolean.TRUE : null));
                visionLog.append(sessionId, schema, clock.instant());
            }

            if (schema.requiresEscalation() && cooldown.tryAcquire(sessionId)) {
                LOG.warn("Threat escalation: {}", schema.details());
                metrics.incrementVisionEvent(GateEventType.THREAT_ESCALATION.name());
                events.offer(GateEvent.of(GateEventType.THREAT_ESCALATION, sessionId, schema.details()));
            }
            lastProcessedAt = clock.instant();
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @EventListener
    public void onSessionStarted(SessionStartedEvent started) {
        liveSessions.add(started.sessionId());
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent ended) {
        liveSessions.remove(ended.sessionId());
        windows.remove(ended.sessionId());
        cooldown.forget(ended.sessionId());
    }

    /** Time the last frame finished processing, or {@code null} if none yet. */
    public Instant lastProcessedAt() {
        return lastProcessedAt;
    }

    private VisionSchema classify(CapturedFrame frame) {
        try {
            Optional<VisionSchema> parsed = VisionSchemaParser.parse(classifier.classify(frame.image(), frame.mimeType()));
            metrics.incrementFramesAnalysed(parsed.isPresent());
            return parsed.orElseGet(VisionSchema::none);
        } catch (CapabilityException e) {
            LOG.warn("Frame {} classification failed; using no-face default: {}", frame.frameId(), e.getMessage());
            metrics.incrementFramesAnalysed(false);
            return VisionSchema.none();
        }
    }
}
