package com.webchat.chatbackend.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.webchat.chatbackend.chat.ConversationKind;
import com.webchat.chatbackend.chat.ParticipantRole;

import java.time.Instant;
import java.util.List;

public record ChatSummaryDto(
        Long id,
        ConversationKind kind,
        String name,
        String avatarUrl,
        String lastMessage,
        Instant lastMessageAt,
        long unreadCount,
        @JsonProperty("isOnline") boolean online,
        @JsonProperty("isBlockedBy") boolean blockedBy,
        ParticipantRole role,
        List<ParticipantDto> participants
) {
}
