package com.webchat.chatbackend.chat;

import java.util.List;

/**
 * What the projector needs to summarize one conversation for one viewer.
 *
 * @param participants   ordered by join time
 * @param lastMessage    newest message, or null for an empty conversation
 * @param recentMessages messages after the viewer's read cursor, newest first, possibly truncated
 */
public record ChatSnapshot(
        Conversation conversation,
        List<Participant> participants,
        Message lastMessage,
        List<Message> recentMessages
) {
}
