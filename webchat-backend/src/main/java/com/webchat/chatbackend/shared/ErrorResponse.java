package com.webchat.chatbackend.shared;

public record ErrorResponse(String kind, String message) {
}
