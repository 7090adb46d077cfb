package com.webchat.chatbackend.realtime;

import com.webchat.chatbackend.presence.ConnectionHandle;
import com.webchat.chatbackend.presence.PresenceRegistry;
import com.webchat.chatbackend.presence.PresenceTransition;
import com.webchat.chatbackend.realtime.event.UserStatusEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Drives a connection through CONNECTING, AUTHENTICATED, ACTIVE and CLOSED.
 * Presence broadcasts are emitted only for real online/offline transitions
 * reported by the registry, never once per handle.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionBridge {

    private final ConnectionAuthenticator authenticator;
    private final PresenceRegistry presenceRegistry;
    private final EventRouter eventRouter;

    /**
     * Authenticates and activates the handle. Returns false when the handle was
     * rejected or closed before it could become active.
     */
    public boolean connect(String token, AbstractConnectionHandle handle) {
        Long userId = authenticator.authenticate(token).orElse(null);
        if (userId == null) {
            log.warn("Rejecting connection {}: invalid or missing token", handle.id());
            handle.markClosed();
            handle.close(CloseStatus.POLICY_VIOLATION);
            return false;
        }
        if (!handle.authenticate(userId)) {
            log.debug("Connection {} closed during handshake", handle.id());
            return false;
        }

        PresenceTransition registered = presenceRegistry.register(userId, handle);
        if (!handle.activate()) {
            // closed while registering; close() left the cleanup to us
            PresenceTransition unregistered = presenceRegistry.unregister(userId, handle);
            eventRouter.release(handle);
            boolean cameOnline = registered == PresenceTransition.CAME_ONLINE;
            boolean wentOffline = unregistered == PresenceTransition.WENT_OFFLINE;
            if (cameOnline != wentOffline) {
                broadcastStatus(userId, cameOnline);
            }
            return false;
        }

        log.info("Connection {} active for user {}", handle.id(), userId);
        if (registered == PresenceTransition.CAME_ONLINE) {
            broadcastStatus(userId, true);
        }
        return true;
    }

    /** Idempotent; safe to call from the transport callback and from eviction. */
    public void close(ConnectionHandle handle) {
        if (!(handle instanceof AbstractConnectionHandle managed)) {
            eventRouter.release(handle);
            return;
        }

        SessionState previous = managed.markClosed();
        if (previous == SessionState.CLOSED) {
            return;
        }
        eventRouter.release(handle);
        if (previous != SessionState.ACTIVE) {
            return;
        }

        Long userId = managed.userId();
        PresenceTransition transition = presenceRegistry.unregister(userId, handle);
        log.info("Connection {} closed for user {}", handle.id(), userId);
        if (transition == PresenceTransition.WENT_OFFLINE) {
            broadcastStatus(userId, false);
        }
    }

    @EventListener
    public void onDeadConnection(DeadConnectionEvent event) {
        log.debug("Closing dead connection {}: {}", event.handle().id(), event.reason());
        close(event.handle());
    }

    private void broadcastStatus(Long userId, boolean online) {
        log.info("User {} is now {}", userId, online ? "online" : "offline");
        eventRouter.deliverToAllExcept(new UserStatusEvent(userId, online), userId);
    }
}
