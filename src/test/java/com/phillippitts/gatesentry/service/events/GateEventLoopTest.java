package com.phillippitts.gatesentry.service.events;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.domain.ThreatLevel;
import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.service.bridge.StateBridge;
import com.phillippitts.gatesentry.service.bridge.StateUpdateRequest;
import com.phillippitts.gatesentry.service.conversation.GateConversationService;
import com.phillippitts.gatesentry.service.decision.DecisionEngine;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import com.phillippitts.gatesentry.testutil.EventCapturingPublisher;
import com.phillippitts.gatesentry.testutil.FakeNluClient;
import com.phillippitts.gatesentry.testutil.GateFixtures;
import com.phillippitts.gatesentry.testutil.RecordingNotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GateEventLoopTest {

    private static final VisionSchema WEAPON = new VisionSchema(true, true, true, ThreatLevel.HIGH, "knife visible");

    private BridgeProperties props;
    private StateBridge bridge;
    private GateEventQueue events;
    private EventCapturingPublisher publisher;
    private GateConversationService conversations;
    private GateEventLoop loop;
    private String sessionId;

    @BeforeEach
    void setUp() {
        props = new BridgeProperties();
        SessionStateStore store = new SessionStateStore();
        events = new GateEventQueue(props);
        bridge = new StateBridge(store, events, props, GateFixtures.metrics());
        publisher = new EventCapturingPublisher();
        conversations = new GateConversationService(store,
                GateFixtures.machine(new FakeNluClient(), new RecordingNotificationDispatcher()),
                GateFixtures.conversationProps(), new EventCapturingPublisher(), GateFixtures.metrics());
        loop = new GateEventLoop(bridge, events, conversations, publisher, props);
        sessionId = conversations.startSession(null);
    }

    @Test
    void eventsWaitUntilBridgeIsCaughtUp() {
        props.setBatchSize(1);
        bridge.submit(StateUpdateRequest.vision(sessionId, WEAPON, null));
        bridge.submit(StateUpdateRequest.vision(sessionId, WEAPON, null));
        events.offer(GateEvent.of(GateEventType.NO_FACE, sessionId, "gone"));

        loop.tick();
        assertThat(publisher.eventsOf(GateNotificationEvent.class)).isEmpty();
        assertThat(bridge.pending()).isEqualTo(1);

        loop.tick();
        assertThat(bridge.pending()).isZero();
        assertThat(publisher.eventsOf(GateNotificationEvent.class))
                .extracting(n -> n.event().type())
                .containsExactly(GateEventType.NO_FACE);
    }

    @Test
    void eventBatchSizeCapsDispatch() {
        props.setEventBatchSize(2);
        for (int i = 0; i < 3; i++) {
            events.offer(GateEvent.of(GateEventType.AGENT_MESSAGE, sessionId, "line " + i));
        }

        loop.tick();

        assertThat(publisher.eventsOf(GateNotificationEvent.class)).hasSize(2);
        assertThat(events.size()).isEqualTo(1);
    }

    @Test
    void escalationRunsSecurityTurnAfterVerdictIsStored() {
        bridge.submit(StateUpdateRequest.vision(sessionId, WEAPON, true));
        events.offer(GateEvent.of(GateEventType.THREAT_ESCALATION, sessionId, "knife visible"));

        loop.tick();

        assertThat(publisher.eventsOf(GateNotificationEvent.class))
                .extracting(GateNotificationEvent::event)
                .satisfiesExactly(
                        escalation -> assertThat(escalation.type()).isEqualTo(GateEventType.THREAT_ESCALATION),
                        reply -> {
                            assertThat(reply.type()).isEqualTo(GateEventType.AGENT_MESSAGE);
                            assertThat(reply.message()).isEqualTo(DecisionEngine.SECURITY_MESSAGE);
                        });
    }

    @Test
    void escalationForEndedSessionOnlyPublishesTheEvent() {
        conversations.endSession(sessionId);
        events.offer(GateEvent.of(GateEventType.THREAT_ESCALATION, sessionId, "knife visible"));

        loop.tick();

        assertThat(publisher.eventsOf(GateNotificationEvent.class)).hasSize(1);
    }
}
