package com.webchat.chatbackend.chat;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MessageRepository extends JpaRepository<Message, Long> {

    // history, oldest first
    List<Message> findByConversationIdOrderByCreatedAtAscIdAsc(Long conversationId);

    Optional<Message> findFirstByConversationIdOrderByCreatedAtDescIdDesc(Long conversationId);

    Optional<Message> findByIdAndConversationId(Long id, Long conversationId);

    // messages after a read cursor, newest first, capped by the caller's page size
    List<Message> findByConversationIdAndCreatedAtAfterOrderByCreatedAtDescIdDesc(
            Long conversationId, Instant after, Pageable pageable);

    @Query("""
        SELECT m FROM Message m
        WHERE m.conversation.id = :conversationId
          AND m.state = com.webchat.chatbackend.chat.MessageState.ACTIVE
          AND lower(m.content) LIKE lower(concat('%', :q, '%'))
        ORDER BY m.createdAt ASC, m.id ASC
        """)
    List<Message> searchActive(@Param("conversationId") Long conversationId, @Param("q") String query);
}
