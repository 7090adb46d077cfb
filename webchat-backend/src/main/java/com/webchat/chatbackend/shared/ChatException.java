package com.webchat.chatbackend.shared;

import org.springframework.web.server.ResponseStatusException;

public class ChatException extends ResponseStatusException {

    private final ChatErrorKind kind;

    public ChatException(ChatErrorKind kind, String message) {
        super(kind.getStatus(), message);
        this.kind = kind;
    }

    public ChatErrorKind getKind() {
        return kind;
    }

    public static ChatException invalid(String message) {
        return new ChatException(ChatErrorKind.INVALID_ARGUMENT, message);
    }

    public static ChatException notFound(String message) {
        return new ChatException(ChatErrorKind.NOT_FOUND, message);
    }

    public static ChatException forbidden(String message) {
        return new ChatException(ChatErrorKind.FORBIDDEN, message);
    }

    public static ChatException blocked(String message) {
        return new ChatException(ChatErrorKind.BLOCKED, message);
    }

    public static ChatException conflict(String message) {
        return new ChatException(ChatErrorKind.CONFLICT, message);
    }
}
