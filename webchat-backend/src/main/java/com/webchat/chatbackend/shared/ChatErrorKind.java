package com.webchat.chatbackend.shared;

import org.springframework.http.HttpStatus;

/**
 * Stable failure kinds returned to clients. Clients branch on the enum name,
 * never on the free-text message.
 */
public enum ChatErrorKind {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    BLOCKED(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ChatErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
