package com.webchat.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationKind {
    DIRECT,
    GROUP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
