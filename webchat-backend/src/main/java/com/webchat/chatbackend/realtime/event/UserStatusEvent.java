package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserStatusEvent(Long userId, @JsonProperty("isOnline") boolean online) implements RealtimeEvent {

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.USER_STATUS_CHANGE;
    }
}
