package com.webchat.chatbackend.realtime;

import com.webchat.chatbackend.presence.ConnectionHandle;

/** Published when a write to a handle fails and the handle must be evicted. */
public record DeadConnectionEvent(ConnectionHandle handle, String reason) {
}
