package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Sent when a message is recalled; clients replace it with a tombstone. */
public record MessageUpdateEvent(
        Long id,
        Long chatId,
        @JsonProperty("isRecalled") boolean recalled,
        String text,
        List<Object> attachments
) implements RealtimeEvent {

    public static MessageUpdateEvent recalled(Long messageId, Long chatId) {
        return new MessageUpdateEvent(messageId, chatId, true, null, List.of());
    }

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.MESSAGE_UPDATE;
    }
}
