package com.webchat.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReactionAction {
    ADDED,
    REMOVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
