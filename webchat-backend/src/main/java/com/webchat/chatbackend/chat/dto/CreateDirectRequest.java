package com.webchat.chatbackend.chat.dto;

import jakarta.validation.constraints.NotNull;

public record CreateDirectRequest(@NotNull Long participantId) {
}
