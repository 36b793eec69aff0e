package com.phillippitts.gatesentry.service.bridge;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.service.events.GateEvent;
import com.phillippitts.gatesentry.service.events.GateEventQueue;
import com.phillippitts.gatesentry.service.events.GateEventType;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.queue.BoundedDropOldestQueue;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Serializes vision-originated state changes into the session store.
 *
 * <p>Producers (the vision consumer) only {@link #submit(StateUpdateRequest) submit}; the event loop calls
 * {@link #drainOnce()} which applies a capped batch, each request atomically under the store lock.
 *
 * <p><b>Activation edges:</b> false→true queues the greeting; true→false queues the farewell and fully
 * resets the session. Each edge fires once because it is derived from the stored value.
 *
 * <p><b>Failures:</b> a request that throws is re-queued at the head and retried on the next cycle, up
 * to {@code gate.bridge.max-attempts} attempts.
 */
@Component
public class StateBridge {

    private static final Logger LOG = LogManager.getLogger(StateBridge.class);

    private final SessionStateStore store;
    private final GateEventQueue events;
    private final BridgeProperties props;
    private final GateMetrics metrics;
    private final BoundedDropOldestQueue<StateUpdateRequest> queue;

    public StateBridge(SessionStateStore store, GateEventQueue events, BridgeProperties props, GateMetrics metrics) {
        this.store = store;
        this.events = events;
        this.props = props;
        this.metrics = metrics;
        this.queue = new BoundedDropOldestQueue<>("state-bridge", props.getQueueCapacity());
    }

    /** Queues a request; drops the oldest pending one if full. Never blocks. */
    public void submit(StateUpdateRequest request) {
        queue.offer(request).ifPresent(dropped -> {
            metrics.incrementBridge("overflow");
            LOG.warn("State bridge queue full; dropped update for session {}", dropped.sessionId());
        });
    }

    /**
     * Applies up to {@code gate.bridge.batch-size} pending requests.
     *
     * @return number of requests applied
     */
    public int drainOnce() {
        List<StateUpdateRequest> batch = queue.pollBatch(props.getBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }
        int applied = 0;
        List<StateUpdateRequest> failed = new ArrayList<>();
        for (StateUpdateRequest request : batch) {
            try {
                if (apply(request)) {
                    applied++;
                }
            } catch (RuntimeException e) {
                StateUpdateRequest retry = request.retried();
                if (retry.attempts() < props.getMaxAttempts()) {
                    LOG.warn("Applying update for session {} failed (attempt {}); will retry",
                            request.sessionId(), retry.attempts(), e);
                    metrics.incrementBridge("retried");
                    failed.add(retry);
                } else {
                    LOG.error("Applying update for session {} failed {} times; dropped",
                            request.sessionId(), retry.attempts(), e);
                    metrics.incrementBridge("abandoned");
                }
            }
        }
        for (int i = failed.size() - 1; i >= 0; i--) {
            if (!queue.pushFront(failed.get(i))) {
                LOG.warn("State bridge queue full; retry for session {} dropped", failed.get(i).sessionId());
            }
        }
        return applied;
    }

    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return queue.droppedCount();
    }

    private boolean apply(StateUpdateRequest request) {
        Optional<ActivationEdge> edge = store.updateIfPresent(request.sessionId(), s -> applyTo(s, request));
        if (edge.isEmpty()) {
            LOG.debug("Update for unknown session {} dropped", request.sessionId());
            metrics.incrementBridge("unknown_session");
            return false;
        }
        metrics.incrementBridge("applied");
        switch (edge.get()) {
            case ACTIVATED -> {
                LOG.info("Session {} activated", request.sessionId());
                events.offer(GateEvent.of(GateEventType.AGENT_MESSAGE, request.sessionId(), props.getGreeting()));
            }
            case DEACTIVATED -> {
                LOG.info("Session {} deactivated and reset", request.sessionId());
                events.offer(GateEvent.of(GateEventType.AGENT_MESSAGE, request.sessionId(), props.getFarewell()));
            }
            case NONE -> {
            }
        }
        return true;
    }

    static ActivationEdge applyTo(SessionState state, StateUpdateRequest request) {
        ActivationEdge edge = ActivationEdge.NONE;
        if (request.sessionActive() != null) {
            boolean was = state.isSessionActive();
            boolean now = request.sessionActive();
            state.setSessionActive(now);
            if (!was && now) {
                edge = ActivationEdge.ACTIVATED;
            } else if (was && !now) {
                edge = ActivationEdge.DEACTIVATED;
                state.resetForNextVisitor();
                state.bumpResetEpoch();
            }
        }
        if (request.visionSchema() != null) {
            state.setVisionSchema(request.visionSchema());
        }
        if (request.authenticated() != null) {
            state.getProfile().setAuthenticated(request.authenticated());
        }
        state.bumpVisionRevision();
        return edge;
    }
}
