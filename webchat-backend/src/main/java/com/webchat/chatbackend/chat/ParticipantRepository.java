package com.webchat.chatbackend.chat;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    // Participant.getUserId() is a helper, so the path is spelled out
    @Query("SELECT p FROM Participant p WHERE p.conversation.id = :conversationId AND p.user.id = :userId")
    Optional<Participant> findByConversationIdAndUserId(@Param("conversationId") Long conversationId,
                                                        @Param("userId") Long userId);

    long countByConversationId(Long conversationId);

    @Query("SELECT p.user.id FROM Participant p WHERE p.conversation.id = :conversationId")
    List<Long> findUserIds(@Param("conversationId") Long conversationId);
}
