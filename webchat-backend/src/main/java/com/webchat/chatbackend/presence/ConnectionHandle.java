package com.webchat.chatbackend.presence;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * One live transport connection owned by a single user. A user may hold
 * several at once (tabs, devices).
 */
public interface ConnectionHandle {

    /** Unique per process lifetime. */
    String id();

    /** Owning user, or null before the connection has authenticated. */
    Long userId();

    /**
     * Writes one serialized event. Implementations must bound the time a
     * single write may block and throw once it is exceeded.
     */
    void send(String payload) throws IOException;

    boolean isOpen();

    void close(CloseStatus status);
}
