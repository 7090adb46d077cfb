package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserBlockEvent(
        Long blockerId,
        Long blockedId,
        @JsonProperty("isBlocked") boolean blocked
) implements RealtimeEvent {

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.USER_BLOCK_UPDATE;
    }
}
