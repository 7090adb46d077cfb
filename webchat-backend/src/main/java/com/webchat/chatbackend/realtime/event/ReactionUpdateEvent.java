package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.webchat.chatbackend.chat.ReactionAction;

public record ReactionUpdateEvent(
        Long messageId,
        Long chatId,
        String emoji,
        ReactionAction action,
        Long userId,
        long count
) implements RealtimeEvent {

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.REACTION_UPDATE;
    }
}
