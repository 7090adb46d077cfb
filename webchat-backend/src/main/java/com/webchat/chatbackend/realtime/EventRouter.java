package com.webchat.chatbackend.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webchat.chatbackend.presence.ConnectionHandle;
import com.webchat.chatbackend.presence.PresenceRegistry;
import com.webchat.chatbackend.realtime.event.RealtimeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.socket.CloseStatus;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans an event out to every live handle of a set of users.
 * <p>
 * Each handle owns an outbox drained by at most one worker at a time, so a
 * handle observes events in the order they were handed to the router, while
 * a slow handle only delays itself. Callers never wait for delivery and never
 * see a delivery failure.
 */
@Component
@Slf4j
public class EventRouter {

    private final PresenceRegistry presenceRegistry;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;
    private final ApplicationEventPublisher eventPublisher;

    private final ConcurrentHashMap<ConnectionHandle, Outbox> outboxes = new ConcurrentHashMap<>();

    public EventRouter(PresenceRegistry presenceRegistry,
                       ObjectMapper objectMapper,
                       @Qualifier("eventDeliveryExecutor") Executor deliveryExecutor,
                       ApplicationEventPublisher eventPublisher) {
        this.presenceRegistry = presenceRegistry;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
        this.eventPublisher = eventPublisher;
    }

    public void deliver(RealtimeEvent event, Collection<Long> targetUserIds) {
        if (targetUserIds == null || targetUserIds.isEmpty()) {
            return;
        }
        String payload = serialize(event);
        if (payload == null) {
            return;
        }

        int handles = 0;
        for (Long userId : new LinkedHashSet<>(targetUserIds)) {
            for (ConnectionHandle handle : presenceRegistry.liveHandles(userId)) {
                if (!handle.isOpen()) {
                    continue;
                }
                outboxFor(handle).offer(payload);
                handles++;
            }
        }
        log.debug("Queued {} event for {} users / {} handles", event.type().wireName(), targetUserIds.size(), handles);
    }

    /**
     * Same as {@link #deliver} but, inside a transaction, waits until it has
     * committed so recipients never see state that could still roll back.
     */
    public void deliverAfterCommit(RealtimeEvent event, Collection<Long> targetUserIds) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            deliver(event, targetUserIds);
            return;
        }
        List<Long> targets = List.copyOf(targetUserIds);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deliver(event, targets);
            }
        });
    }

    /** Every online user except {@code excludedUserId}. */
    public void deliverToAllExcept(RealtimeEvent event, Long excludedUserId) {
        Set<Long> targets = new LinkedHashSet<>(presenceRegistry.onlineUserIds());
        targets.remove(excludedUserId);
        deliver(event, targets);
    }

    /** Drops the outbox of a handle that has been closed; queued events are discarded. */
    public void release(ConnectionHandle handle) {
        Outbox outbox = outboxes.remove(handle);
        if (outbox != null) {
            outbox.discard();
        }
    }

    int pendingOutboxes() {
        return outboxes.size();
    }

    private Outbox outboxFor(ConnectionHandle handle) {
        return outboxes.computeIfAbsent(handle, Outbox::new);
    }

    private String serialize(RealtimeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event", event.type(), e);
            return null;
        }
    }

    private void evict(ConnectionHandle handle, Exception cause) {
        log.warn("Delivery to handle {} of user {} failed, evicting: {}",
                handle.id(), handle.userId(), cause.toString());
        release(handle);
        try {
            handle.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (RuntimeException closeError) {
            log.debug("Closing dead handle {} failed: {}", handle.id(), closeError.toString());
        }
        eventPublisher.publishEvent(new DeadConnectionEvent(handle, cause.toString()));
    }

    private final class Outbox implements Runnable {

        private final ConnectionHandle handle;
        private final Queue<String> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private volatile boolean dead;

        private Outbox(ConnectionHandle handle) {
            this.handle = handle;
        }

        void offer(String payload) {
            if (dead) {
                return;
            }
            pending.add(payload);
            schedule();
        }

        void discard() {
            dead = true;
            pending.clear();
        }

        private void schedule() {
            if (!scheduled.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                discard();
                evict(handle, e);
            }
        }

        @Override
        public void run() {
            Exception failure = null;
            try {
                String payload;
                while (!dead && (payload = pending.poll()) != null) {
                    handle.send(payload);
                }
            } catch (Exception e) {
                failure = e;
                discard();
            } finally {
                scheduled.set(false);
            }

            if (failure != null) {
                evict(handle, failure);
            } else if (!dead && !pending.isEmpty()) {
                // an offer raced with the end of the drain loop
                schedule();
            }
        }
    }
}
