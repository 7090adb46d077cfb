package com.webchat.chatbackend.chat;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    Optional<Conversation> findByDirectKey(String directKey);

    // newest activity first
    @Query("""
        SELECT c FROM Conversation c
        WHERE EXISTS (SELECT p.id FROM Participant p WHERE p.conversation = c AND p.user.id = :userId)
        ORDER BY c.lastMessageAt DESC, c.id DESC
        """)
    List<Conversation> findAllForUser(@Param("userId") Long userId);
}
