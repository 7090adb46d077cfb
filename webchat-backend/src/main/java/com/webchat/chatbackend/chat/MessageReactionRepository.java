package com.webchat.chatbackend.chat;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MessageReactionRepository extends JpaRepository<MessageReaction, Long> {

    Optional<MessageReaction> findByMessageIdAndUserIdAndEmoji(Long messageId, Long userId, String emoji);

    long countByMessageIdAndEmoji(Long messageId, String emoji);

    List<MessageReaction> findByMessageIdIn(Collection<Long> messageIds);
}
