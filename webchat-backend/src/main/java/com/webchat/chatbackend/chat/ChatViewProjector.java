package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.chat.dto.ChatSummaryDto;
import com.webchat.chatbackend.chat.dto.ParticipantDto;
import com.webchat.chatbackend.presence.PresenceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Builds the chat-list entry a viewer sees. Reads only; never writes domain
 * state.
 */
@Component
@RequiredArgsConstructor
public class ChatViewProjector {

    public static final String DEFAULT_GROUP_NAME = "Group Chat";
    static final String UNKNOWN_NAME = "Unknown";
    static final String RECALLED_PREVIEW = "Message recalled";

    private final PresenceRegistry presenceRegistry;

    public ChatSummaryDto project(ChatSnapshot snapshot, Long viewerId, Set<Long> blockerIds) {
        Conversation conversation = snapshot.conversation();

        Participant self = null;
        Participant other = null;
        for (Participant p : snapshot.participants()) {
            if (viewerId.equals(p.getUserId())) {
                self = p;
            } else if (other == null) {
                other = p;
            }
        }

        String name;
        String avatarUrl = null;
        boolean online = false;
        boolean blockedBy = false;
        if (conversation.isGroup()) {
            name = StringUtils.hasText(conversation.getName()) ? conversation.getName() : DEFAULT_GROUP_NAME;
        } else if (other != null) {
            name = other.getUser().getUsername();
            avatarUrl = other.getUser().getAvatarUrl();
            online = presenceRegistry.isOnline(other.getUserId());
            blockedBy = blockerIds.contains(other.getUserId());
        } else {
            name = UNKNOWN_NAME;
        }

        Message last = snapshot.lastMessage();
        Instant lastActivity = last != null ? last.getCreatedAt() : conversation.getLastMessageAt();
        long unread = self == null ? 0 : unreadCount(snapshot.recentMessages(), self.getLastReadAt(), viewerId);

        List<ParticipantDto> participants = snapshot.participants().stream()
                .map(ParticipantDto::from)
                .toList();

        return new ChatSummaryDto(
                conversation.getId(),
                conversation.getKind(),
                name,
                avatarUrl,
                preview(last),
                lastActivity,
                unread,
                online,
                blockedBy,
                self == null ? null : self.getRole(),
                participants
        );
    }

    /** Messages strictly after the cursor that the viewer did not send. */
    static long unreadCount(Collection<Message> messages, Instant readCursor, Long viewerId) {
        return messages.stream()
                .filter(m -> readCursor == null || m.getCreatedAt().isAfter(readCursor))
                .filter(m -> !viewerId.equals(m.getSenderId()))
                .count();
    }

    static String preview(Message m) {
        if (m == null) {
            return "";
        }
        if (m.isTombstoned()) {
            return RECALLED_PREVIEW;
        }
        if (StringUtils.hasText(m.getContent())) {
            return m.getContent();
        }
        if (!m.getAttachments().isEmpty()) {
            boolean allImages = m.getAttachments().stream().allMatch(Attachment::isImage);
            return allImages ? "Image" : "File";
        }
        return switch (m.getType()) {
            case IMAGE -> "Image";
            case FILE -> "File";
            case VIDEO -> "Video";
            default -> "Attachment";
        };
    }
}
