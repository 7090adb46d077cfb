package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    MESSAGE("message"),
    MESSAGE_UPDATE("message_update"),
    REACTION_UPDATE("reaction_update"),
    USER_STATUS_CHANGE("user_status_change"),
    USER_BLOCK_UPDATE("user_block_update"),
    GROUP_EVENT("group_event");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
