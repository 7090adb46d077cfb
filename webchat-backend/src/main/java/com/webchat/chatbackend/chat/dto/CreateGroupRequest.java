package com.webchat.chatbackend.chat.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateGroupRequest(
        @NotEmpty List<Long> participantIds,
        @Size(max = 100) String name
) {
}
