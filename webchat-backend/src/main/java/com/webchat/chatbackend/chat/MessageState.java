package com.webchat.chatbackend.chat;

/** ACTIVE may become TOMBSTONED; a tombstone never reverts. */
public enum MessageState {
    ACTIVE,
    TOMBSTONED
}
