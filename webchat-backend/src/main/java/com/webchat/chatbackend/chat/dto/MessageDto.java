package com.webchat.chatbackend.chat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.webchat.chatbackend.chat.Message;
import com.webchat.chatbackend.chat.MessageType;
import com.webchat.chatbackend.user.User;

import java.time.Instant;
import java.util.List;

/**
 * A message as clients see it. {@code incoming} is relative to the viewer and
 * left out of broadcast payloads, which every recipient interprets itself.
 */
public record MessageDto(
        Long id,
        Long chatId,
        Long senderId,
        String senderName,
        String senderAvatarUrl,
        String text,
        MessageType messageType,
        Instant createdAt,
        boolean recalled,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean incoming,
        List<AttachmentDto> attachments,
        List<ReactionCountDto> reactions
) {

    public static final String SYSTEM_SENDER_NAME = "System";

    public static MessageDto of(Message m, Long chatId, Long viewerId, List<ReactionCountDto> reactions) {
        User sender = m.getSender();
        List<AttachmentDto> attachments = m.isTombstoned()
                ? List.of()
                : m.getAttachments().stream().map(AttachmentDto::from).toList();
        // system notices have no sender and are never incoming
        Boolean incoming = viewerId == null ? null : m.getSenderId() != null && !viewerId.equals(m.getSenderId());
        return new MessageDto(
                m.getId(),
                chatId,
                sender == null ? null : sender.getId(),
                sender == null ? SYSTEM_SENDER_NAME : sender.getUsername(),
                sender == null ? null : sender.getAvatarUrl(),
                m.isTombstoned() ? null : m.getContent(),
                m.getType(),
                m.getCreatedAt(),
                m.isTombstoned(),
                incoming,
                attachments,
                reactions == null ? List.of() : reactions
        );
    }

    /** Broadcast form: no viewer, no reactions yet. */
    public static MessageDto broadcast(Message m, Long chatId) {
        return of(m, chatId, null, List.of());
    }
}
