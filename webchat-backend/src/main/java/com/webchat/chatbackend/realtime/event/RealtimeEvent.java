package com.webchat.chatbackend.realtime.event;

/**
 * A payload pushed to live connections. Serialized as JSON with a {@code type}
 * discriminator so clients can switch on it.
 */
public interface RealtimeEvent {

    EventType type();
}
