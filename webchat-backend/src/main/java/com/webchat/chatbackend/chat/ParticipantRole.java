package com.webchat.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantRole {
    ADMIN,
    MEMBER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
