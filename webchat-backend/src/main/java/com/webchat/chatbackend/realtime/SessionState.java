package com.webchat.chatbackend.realtime;

public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSED
}
