package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.webchat.chatbackend.chat.dto.MessageDto;

public record MessageEvent(@JsonUnwrapped MessageDto message) implements RealtimeEvent {

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.MESSAGE;
    }
}
