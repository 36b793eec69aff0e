package com.phillippitts.gatesentry.service.session;

import com.phillippitts.gatesentry.exception.TurnInProgressException;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which sessions are currently running a conversation turn.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → IN_TURN (via enter)
 * IN_TURN → IDLE (via exit)
 * </pre>
 *
 * <p><b>Thread Safety:</b> all public methods use a single {@link ReentrantLock}.
 */
public final class TurnGuard {

    private final Lock lock = new ReentrantLock();
    private final Set<String> inTurn = new HashSet<>();

    /**
     * Marks the session as in a turn.
     *
     * @throws TurnInProgressException if another turn for the session has not finished
     */
    public void enter(String sessionId) {
        if (sessionId == null) {
            throw new NullPointerException("sessionId cannot be null");
        }
        lock.lock();
        try {
            if (!inTurn.add(sessionId)) {
                throw new TurnInProgressException(sessionId);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Releases the session; a no-op if it was not in a turn. */
    public void exit(String sessionId) {
        lock.lock();
        try {
            inTurn.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isInTurn(String sessionId) {
        lock.lock();
        try {
            return inTurn.contains(sessionId);
        } finally {
            lock.unlock();
        }
    }
}
