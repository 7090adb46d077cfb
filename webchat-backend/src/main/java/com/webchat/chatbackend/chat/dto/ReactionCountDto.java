package com.webchat.chatbackend.chat.dto;

public record ReactionCountDto(String emoji, long count, boolean reactedByMe) {
}
