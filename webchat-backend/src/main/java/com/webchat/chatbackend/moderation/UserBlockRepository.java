package com.webchat.chatbackend.moderation;

import com.webchat.chatbackend.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserBlockRepository extends JpaRepository<UserBlock, Long> {

    Optional<UserBlock> findByBlockerIdAndBlockedId(Long blockerId, Long blockedId);

    boolean existsByBlockerIdAndBlockedId(Long blockerId, Long blockedId);

    // does any of the given users block the sender?
    boolean existsByBlockedIdAndBlockerIdIn(Long blockedId, Collection<Long> blockerIds);

    @Query("SELECT b.blocker.id FROM UserBlock b WHERE b.blocked.id = :userId")
    List<Long> findBlockerIds(@Param("userId") Long userId);

    @Query("SELECT b.blocked FROM UserBlock b WHERE b.blocker.id = :blockerId ORDER BY b.createdAt DESC")
    List<User> findBlockedUsers(@Param("blockerId") Long blockerId);
}
