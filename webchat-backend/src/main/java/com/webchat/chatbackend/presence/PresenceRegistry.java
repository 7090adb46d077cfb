package com.webchat.chatbackend.presence;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Maps a user id to the set of live connection handles. A user is online iff
 * the entry exists; empty entries are never kept.
 * <p>
 * Per-user transitions run inside {@link ConcurrentHashMap#compute}, which
 * locks only that user's bin, so register/unregister for the same user are
 * serialized while unrelated users never contend.
 */
@Component
@Slf4j
public class PresenceRegistry {

    private final ConcurrentHashMap<Long, Set<ConnectionHandle>> connections = new ConcurrentHashMap<>();

    public PresenceTransition register(Long userId, ConnectionHandle handle) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(handle, "handle");

        AtomicBoolean cameOnline = new AtomicBoolean(false);
        connections.compute(userId, (id, handles) -> {
            Set<ConnectionHandle> next = handles;
            if (next == null) {
                next = ConcurrentHashMap.newKeySet();
                cameOnline.set(true);
            }
            next.add(handle);
            return next;
        });

        log.debug("Registered handle {} for user {} (online transition: {})", handle.id(), userId, cameOnline.get());
        return cameOnline.get() ? PresenceTransition.CAME_ONLINE : PresenceTransition.UNCHANGED;
    }

    public PresenceTransition unregister(Long userId, ConnectionHandle handle) {
        if (userId == null || handle == null) {
            return PresenceTransition.UNCHANGED;
        }

        AtomicBoolean wentOffline = new AtomicBoolean(false);
        connections.computeIfPresent(userId, (id, handles) -> {
            if (handles.remove(handle) && handles.isEmpty()) {
                wentOffline.set(true);
                return null;
            }
            return handles;
        });

        log.debug("Unregistered handle {} for user {} (offline transition: {})", handle.id(), userId, wentOffline.get());
        return wentOffline.get() ? PresenceTransition.WENT_OFFLINE : PresenceTransition.UNCHANGED;
    }

    public boolean isOnline(Long userId) {
        return userId != null && connections.containsKey(userId);
    }

    /** Snapshot of the user's handles; safe to iterate while sends are in flight. */
    public Set<ConnectionHandle> liveHandles(Long userId) {
        if (userId == null) {
            return Set.of();
        }
        Set<ConnectionHandle> handles = connections.get(userId);
        return handles == null ? Set.of() : Set.copyOf(handles);
    }

    public Set<Long> onlineUserIds() {
        return Set.copyOf(connections.keySet());
    }

    public int connectionCount(Long userId) {
        return liveHandles(userId).size();
    }

    @PreDestroy
    public void clear() {
        log.info("Clearing presence registry ({} users online)", connections.size());
        connections.clear();
    }
}
