package com.webchat.chatbackend.moderation;

import com.webchat.chatbackend.realtime.EventRouter;
import com.webchat.chatbackend.realtime.event.UserBlockEvent;
import com.webchat.chatbackend.shared.ChatException;
import com.webchat.chatbackend.shared.UniqueRowWriter;
import com.webchat.chatbackend.user.UserRepository;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Block relationships between users and the pre-write send gate derived from
 * them. A sender may not post into a conversation where any other participant
 * has blocked them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationGuard {

    private final UserBlockRepository blockRepository;
    private final UserRepository userRepository;
    private final EventRouter eventRouter;
    private final UniqueRowWriter uniqueRowWriter;

    @Transactional(readOnly = true)
    public SendDecision canSend(Long senderId, Collection<Long> participantIds) {
        Set<Long> others = new HashSet<>(participantIds);
        others.remove(senderId);
        if (others.isEmpty()) {
            return SendDecision.ALLOWED;
        }
        return blockRepository.existsByBlockedIdAndBlockerIdIn(senderId, others)
                ? SendDecision.BLOCKED
                : SendDecision.ALLOWED;
    }

    /** Throws {@code BLOCKED} unless {@link #canSend} allows the send. */
    public void requireCanSend(Long senderId, Collection<Long> participantIds) {
        if (!canSend(senderId, participantIds).isAllowed()) {
            throw ChatException.blocked("You are blocked by a participant of this conversation");
        }
    }

    @Transactional
    public void blockUser(Long blockerId, Long blockedId) {
        if (blockerId.equals(blockedId)) {
            throw ChatException.invalid("You cannot block yourself");
        }
        if (!userRepository.existsById(blockedId)) {
            throw ChatException.notFound("User not found");
        }
        if (blockRepository.existsByBlockerIdAndBlockedId(blockerId, blockedId)) {
            return;
        }

        boolean inserted = uniqueRowWriter.insert(
                () -> blockRepository.saveAndFlush(new UserBlock(
                        userRepository.getReferenceById(blockerId), userRepository.getReferenceById(blockedId))),
                () -> blockRepository.existsByBlockerIdAndBlockedId(blockerId, blockedId));
        if (!inserted) {
            return;
        }
        log.info("User {} blocked user {}", blockerId, blockedId);
        eventRouter.deliverAfterCommit(new UserBlockEvent(blockerId, blockedId, true), List.of(blockerId, blockedId));
    }

    @Transactional
    public void unblockUser(Long blockerId, Long blockedId) {
        if (blockerId.equals(blockedId)) {
            throw ChatException.invalid("You cannot unblock yourself");
        }
        if (!userRepository.existsById(blockedId)) {
            throw ChatException.notFound("User not found");
        }
        blockRepository.findByBlockerIdAndBlockedId(blockerId, blockedId).ifPresent(block -> {
            blockRepository.delete(block);
            log.info("User {} unblocked user {}", blockerId, blockedId);
            eventRouter.deliverAfterCommit(new UserBlockEvent(blockerId, blockedId, false), List.of(blockerId, blockedId));
        });
    }

    @Transactional(readOnly = true)
    public List<UserSummaryDto> listBlocked(Long blockerId) {
        return blockRepository.findBlockedUsers(blockerId).stream()
                .map(UserSummaryDto::from)
                .toList();
    }

    /** Users who have blocked {@code viewerId}. */
    @Transactional(readOnly = true)
    public Set<Long> blockerIdsOf(Long viewerId) {
        return Set.copyOf(blockRepository.findBlockerIds(viewerId));
    }
}
