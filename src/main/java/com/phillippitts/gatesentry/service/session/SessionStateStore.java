package com.phillippitts.gatesentry.service.session;

import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Authoritative map of {@code sessionId → SessionState}.
 *
 * <p>Every read and write goes through one {@link ReentrantLock}. Callers never receive the stored
 * instance: reads return copies, writes run a callback under the lock.
 *
 * <p>Conversation turns work on a {@link #snapshot(String) snapshot} and hand it back via
 * {@link #commitTurn(SessionState, SessionState, boolean)}, which merges bridge writes made meanwhile.
 */
@Component
public class SessionStateStore {

    private static final Logger LOG = LogManager.getLogger(SessionStateStore.class);

    private final Lock lock = new ReentrantLock();
    private final Map<String, SessionState> sessions = new HashMap<>();

    /**
     * Registers a new session.
     *
     * @throws IllegalStateException if the id is already in use
     */
    public SessionState create(String sessionId, String preamble) {
        lock.lock();
        try {
            if (sessions.containsKey(sessionId)) {
                throw new IllegalStateException("Session already exists: " + sessionId);
            }
            SessionState state = new SessionState(sessionId, preamble);
            sessions.put(sessionId, state);
            return state.copy();
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(String sessionId) {
        lock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a detached copy of the session.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public SessionState snapshot(String sessionId) {
        lock.lock();
        try {
            return require(sessionId).copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a mutation atomically.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public <T> T update(String sessionId, Function<SessionState, T> mutation) {
        lock.lock();
        try {
            return mutation.apply(require(sessionId));
        } finally {
            lock.unlock();
        }
    }

    /** Applies a mutation atomically if the session exists. */
    public <T> Optional<T> updateIfPresent(String sessionId, Function<SessionState, T> mutation) {
        lock.lock();
        try {
            SessionState state = sessions.get(sessionId);
            return state == null ? Optional.empty() : Optional.ofNullable(mutation.apply(state));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the result of a turn.
     *
     * <p>If the bridge reset the session (reset epoch moved) or the session was removed, the turn is
     * discarded. If the bridge only updated vision fields, those newer values win over the turn's copy.
     * The camera binding is always taken from the stored state.
     *
     * @param worked       state the turn produced
     * @param base         snapshot the turn started from
     * @param profileReset whether the turn reset the visitor profile
     */
    public CommitOutcome commitTurn(SessionState worked, SessionState base, boolean profileReset) {
        String sessionId = worked.getSessionId();
        lock.lock();
        try {
            SessionState current = sessions.get(sessionId);
            if (current == null) {
                LOG.debug("Session {} removed during turn; result dropped", sessionId);
                return CommitOutcome.DISCARDED;
            }
            if (current.getResetEpoch() != base.getResetEpoch()) {
                LOG.info("Session {} was reset during turn; result dropped", sessionId);
                return CommitOutcome.DISCARDED;
            }
            SessionState merged = worked.copy();
            merged.setCameraId(current.getCameraId());
            CommitOutcome outcome = CommitOutcome.COMMITTED;
            if (current.getVisionRevision() != base.getVisionRevision()) {
                merged.setVisionSchema(current.getVisionSchema());
                merged.setSessionActive(current.isSessionActive());
                if (!profileReset && current.getProfile().isAuthenticated()) {
                    merged.getProfile().setAuthenticated(true);
                }
                while (merged.getVisionRevision() < current.getVisionRevision()) {
                    merged.bumpVisionRevision();
                }
                outcome = CommitOutcome.MERGED;
            }
            sessions.put(sessionId, merged);
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /** Removes the session; returns whether it existed. */
    public boolean remove(String sessionId) {
        lock.lock();
        try {
            return sessions.remove(sessionId) != null;
        } finally {
            lock.unlock();
        }
    }

    public List<String> sessionIds() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of every session bound to a camera, as {@code sessionId → cameraId}. */
    public Map<String, String> cameraBindings() {
        lock.lock();
        try {
            Map<String, String> out = new HashMap<>();
            sessions.forEach((id, s) -> {
                if (s.getCameraId() != null) {
                    out.put(id, s.getCameraId());
                }
            });
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    private SessionState require(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return state;
    }
}
