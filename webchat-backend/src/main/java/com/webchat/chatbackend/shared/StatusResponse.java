package com.webchat.chatbackend.shared;

public record StatusResponse(String status, String message) {

    public static StatusResponse success(String message) {
        return new StatusResponse("success", message);
    }
}
