package com.webchat.chatbackend.realtime;

import com.webchat.chatbackend.presence.ConnectionHandle;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Base for transport-backed handles. Carries the lifecycle state driven by
 * {@link SessionBridge}; every transition is a compare-and-set so a close
 * racing with the handshake resolves to exactly one winner.
 */
public abstract class AbstractConnectionHandle implements ConnectionHandle {

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private volatile Long userId;

    @Override
    public Long userId() {
        return userId;
    }

    public SessionState state() {
        return state.get();
    }

    boolean authenticate(Long userId) {
        if (state.compareAndSet(SessionState.CONNECTING, SessionState.AUTHENTICATED)) {
            this.userId = userId;
            return true;
        }
        return false;
    }

    boolean activate() {
        return state.compareAndSet(SessionState.AUTHENTICATED, SessionState.ACTIVE);
    }

    /** Moves to CLOSED and returns the state the handle was in. */
    SessionState markClosed() {
        return state.getAndSet(SessionState.CLOSED);
    }

    @Override
    public boolean isOpen() {
        return state.get() != SessionState.CLOSED && isTransportOpen();
    }

    protected abstract boolean isTransportOpen();
}
