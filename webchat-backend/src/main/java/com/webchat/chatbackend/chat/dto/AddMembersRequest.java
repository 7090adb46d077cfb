package com.webchat.chatbackend.chat.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddMembersRequest(@NotEmpty List<Long> userIds) {
}
