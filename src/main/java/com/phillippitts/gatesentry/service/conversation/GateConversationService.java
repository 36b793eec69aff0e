package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.exception.TurnInProgressException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.session.CommitOutcome;
import com.phillippitts.gatesentry.service.session.SessionEndedEvent;
import com.phillippitts.gatesentry.service.session.SessionStartedEvent;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import com.phillippitts.gatesentry.service.session.TurnGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for conversation turns and session lifecycle.
 *
 * <p><b>Turn model:</b> a turn runs on a snapshot of the stored session, outside the store lock, and is
 * committed back when the machine reaches END. At most one turn per session runs at a time; a second
 * concurrent turn is rejected with {@link TurnInProgressException}.
 *
 * <p><b>Logging:</b> the session id is put in the Log4j2 ThreadContext for the duration of a turn.
 */
@Service
public class GateConversationService {

    private static final Logger LOG = LogManager.getLogger(GateConversationService.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final SessionStateStore store;
    private final GateStateMachine machine;
    private final ConversationProperties props;
    private final ApplicationEventPublisher publisher;
    private final GateMetrics metrics;
    private final TurnGuard turnGuard = new TurnGuard();

    public GateConversationService(SessionStateStore store,
                                   GateStateMachine machine,
                                   ConversationProperties props,
                                   ApplicationEventPublisher publisher,
                                   GateMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.machine = Objects.requireNonNull(machine, "machine must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Creates a session with the system preamble.
     *
     * @param cameraId door/camera to bind, or {@code null}
     * @return new session id
     */
    public String startSession(String cameraId) {
        String sessionId = UUID.randomUUID().toString();
        store.create(sessionId, props.getPreamble());
        publisher.publishEvent(new SessionStartedEvent(sessionId, Instant.now()));
        if (cameraId != null && !cameraId.isBlank()) {
            bindCamera(sessionId, cameraId);
        }
        LOG.info("Session {} started (camera={})", sessionId, cameraId);
        return sessionId;
    }

    /**
     * Runs one turn for the visitor line.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws TurnInProgressException  if a turn for the session is already running
     */
    public TurnOutcome handleTurn(String sessionId, String input) {
        turnGuard.enter(sessionId);
        String previousMdc = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        long start = System.nanoTime();
        try {
            SessionState base = store.snapshot(sessionId);
            TurnContext ctx = new TurnContext(base.copy(), input);
            machine.run(ctx);

            CommitOutcome outcome = store.commitTurn(ctx.state(), base, ctx.isProfileReset());
            if (outcome != CommitOutcome.COMMITTED) {
                LOG.info("Turn commit outcome: {}", outcome);
            }
            LOG.debug("Turn path: {}", ctx.path());

            Decision decision = ctx.decision() == null ? Decision.NONE : ctx.decision().decision();
            double confidence = ctx.decision() == null ? 0.0 : ctx.decision().confidence();
            return new TurnOutcome(ctx.replies(), ctx.isSessionComplete(), decision, confidence);
        } finally {
            metrics.recordTurn(System.nanoTime() - start);
            if (previousMdc == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previousMdc);
            }
            turnGuard.exit(sessionId);
        }
    }

    /**
     * Runs a turn on behalf of the visitor, used when the camera raised an escalation.
     *
     * @return the outcome, or empty if the session is gone or already in a turn
     */
    public Optional<TurnOutcome> runSyntheticTurn(String sessionId, String input) {
        try {
            return Optional.of(handleTurn(sessionId, input));
        } catch (TurnInProgressException e) {
            LOG.info("Session {} busy; synthetic turn skipped", sessionId);
            return Optional.empty();
        } catch (SessionNotFoundException e) {
            LOG.debug("Session {} gone; synthetic turn skipped", sessionId);
            return Optional.empty();
        }
    }

    /** @throws SessionNotFoundException if the session does not exist */
    public ProfileSnapshot profile(String sessionId) {
        return ProfileSnapshot.of(store.snapshot(sessionId));
    }

    /** @throws SessionNotFoundException if the session does not exist */
    public void bindCamera(String sessionId, String cameraId) {
        store.update(sessionId, s -> {
            s.setCameraId(cameraId);
            return null;
        });
        LOG.info("Session {} bound to camera {}", sessionId, cameraId);
    }

    /**
     * Removes the session and announces it.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public void endSession(String sessionId) {
        if (!store.remove(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        publisher.publishEvent(new SessionEndedEvent(sessionId, Instant.now()));
        LOG.info("Session {} ended", sessionId);
    }

    public boolean exists(String sessionId) {
        return store.exists(sessionId);
    }
}
