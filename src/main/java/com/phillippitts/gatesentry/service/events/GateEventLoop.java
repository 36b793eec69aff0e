package com.phillippitts.gatesentry.service.events;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.conversation.GateConversationService;
import com.phillippitts.gatesentry.service.conversation.TurnOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Orchestrator-side polling loop.
 *
 * <p>Each cycle applies a batch of bridge updates first, then, once the bridge is caught up, dispatches
 * a batch of gate events. Updates queued while the batch was being polled are applied before dispatch,
 * so a state update is always visible before any event raised after it.
 *
 * <p>Every event is republished as a {@link GateNotificationEvent}. A threat escalation additionally
 * runs a synthetic visitor turn so the session routes straight to a security decision; its reply is
 * published as an agent message.
 */
@Component
public class GateEventLoop {

    private static final Logger LOG = LogManager.getLogger(GateEventLoop.class);

    private final StateBridge bridge;
    private final GateEventQueue events;
    private final GateConversationService conversations;
    private final ApplicationEventPublisher publisher;
    private final BridgeProperties props;

    public GateEventLoop(StateBridge bridge,
                         GateEventQueue events,
                         GateConversationService conversations,
                         ApplicationEventPublisher publisher,
                         BridgeProperties props) {
        this.bridge = bridge;
        this.events = events;
        this.conversations = conversations;
        this.publisher = publisher;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${gate.bridge.poll-interval-ms:50}")
    public void tick() {
        try {
            bridge.drainOnce();
            if (bridge.pending() > 0) {
                return;
            }
            List<GateEvent> batch = events.pollBatch(props.getEventBatchSize());
            if (batch.isEmpty()) {
                return;
            }
            catchUpBridge();
            for (GateEvent event : batch) {
                dispatch(event);
            }
        } catch (RuntimeException e) {
            LOG.error("Event loop cycle failed", e);
        }
    }

    /**
     * Applies every update that was queued before the polled events were raised. Bounded so a busy
     * producer cannot starve event dispatch.
     */
    private void catchUpBridge() {
        int rounds = props.getQueueCapacity() / props.getBatchSize() + 1;
        for (int i = 0; i < rounds && bridge.pending() > 0; i++) {
            bridge.drainOnce();
        }
    }

    void dispatch(GateEvent event) {
        publisher.publishEvent(new GateNotificationEvent(event));
        if (event.type() != GateEventType.THREAT_ESCALATION) {
            return;
        }
        LOG.warn("Escalation for session {}; running security turn", event.sessionId());
        Optional<TurnOutcome> outcome = conversations.runSyntheticTurn(event.sessionId(), props.getEscalationMessage());
        outcome.filter(o -> !o.replies().isEmpty()).ifPresent(o -> publisher.publishEvent(new GateNotificationEvent(
                GateEvent.of(GateEventType.AGENT_MESSAGE, event.sessionId(), o.reply()))));
    }
}
