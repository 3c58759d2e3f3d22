package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.domain.SessionState;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle of one streaming session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * ACTIVE → DRAINING (via beginDrain)
 * DRAINING → CLOSED (via markClosed)
 * </pre>
 * Transitions only move forward; a CLOSED session never becomes ACTIVE again.
 */
public final class SessionStateMachine {

    private final Lock lock = new ReentrantLock();
    private SessionState state = SessionState.ACTIVE;

    /**
     * Starts draining.
     *
     * @return {@code true} if this call moved the session out of ACTIVE,
     *         {@code false} if it was already draining or closed
     */
    public boolean beginDrain() {
        lock.lock();
        try {
            if (state != SessionState.ACTIVE) {
                return false;
            }
            state = SessionState.DRAINING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the session to CLOSED from any state.
     *
     * @return the previous state
     */
    public SessionState markClosed() {
        lock.lock();
        try {
            SessionState previous = state;
            state = SessionState.CLOSED;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public SessionState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        return current() == SessionState.ACTIVE;
    }

    public boolean isClosed() {
        return current() == SessionState.CLOSED;
    }
}
