package com.webchat.chatbackend.moderation;

public enum SendDecision {
    ALLOWED,
    BLOCKED;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
