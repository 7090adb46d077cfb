package com.webchat.chatbackend.chat.dto;

import com.webchat.chatbackend.chat.ReactionAction;

public record ReactionResult(Long messageId, String emoji, ReactionAction action, long count) {
}
