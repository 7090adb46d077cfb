package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.chat.dto.ChatSummaryDto;
import com.webchat.chatbackend.chat.dto.MessageDto;
import com.webchat.chatbackend.chat.dto.ReactionCountDto;
import com.webchat.chatbackend.chat.dto.ReactionResult;
import com.webchat.chatbackend.moderation.ModerationGuard;
import com.webchat.chatbackend.realtime.EventRouter;
import com.webchat.chatbackend.realtime.event.GroupEvent;
import com.webchat.chatbackend.realtime.event.GroupEventKind;
import com.webchat.chatbackend.realtime.event.MessageEvent;
import com.webchat.chatbackend.realtime.event.MessageUpdateEvent;
import com.webchat.chatbackend.realtime.event.ReactionUpdateEvent;
import com.webchat.chatbackend.shared.ChatException;
import com.webchat.chatbackend.shared.UniqueRowWriter;
import com.webchat.chatbackend.storage.StorageService;
import com.webchat.chatbackend.storage.StoredFile;
import com.webchat.chatbackend.user.User;
import com.webchat.chatbackend.user.UserRepository;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conversation, membership, message and reaction state transitions. Every
 * public operation is one transaction; realtime events are handed to the
 * router only once that transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    static final String ATTACHMENT_FOLDER = "attachments";

    private final ConversationRepository conversationRepository;
    private final ParticipantRepository participantRepository;
    private final MessageRepository messageRepository;
    private final MessageReactionRepository reactionRepository;
    private final UserRepository userRepository;
    private final DirectConversationResolver directConversationResolver;
    private final ModerationGuard moderationGuard;
    private final ChatViewProjector viewProjector;
    private final EventRouter eventRouter;
    private final StorageService storageService;
    private final UniqueRowWriter uniqueRowWriter;

    @Value("${webchat.upload.max-file-size-bytes:10485760}")
    private long maxFileSizeBytes;

    @Value("${webchat.chat.unread-window:1000}")
    private int unreadWindow;

    /* ---------- queries ---------- */

    @Transactional(readOnly = true)
    public List<ChatSummaryDto> getUserChats(Long userId) {
        Set<Long> blockerIds = moderationGuard.blockerIdsOf(userId);
        return conversationRepository.findAllForUser(userId).stream()
                .map(c -> viewProjector.project(snapshot(c, userId), userId, blockerIds))
                .toList();
    }

    @Transactional(readOnly = true)
    public ChatSummaryDto getChat(Long userId, Long chatId) {
        Conversation conversation = requireConversation(chatId);
        requireParticipant(chatId, userId);
        return project(conversation, userId);
    }

    /** History oldest first; a non-blank query restricts it to live messages containing the text. */
    @Transactional(readOnly = true)
    public List<MessageDto> getMessages(Long viewerId, Long chatId, String query) {
        requireConversation(chatId);
        requireParticipant(chatId, viewerId);

        List<Message> messages = StringUtils.hasText(query)
                ? messageRepository.searchActive(chatId, query.trim())
                : messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc(chatId);
        if (messages.isEmpty()) {
            return List.of();
        }

        Map<Long, List<ReactionCountDto>> reactions = reactionCounts(
                messages.stream().map(Message::getId).toList(), viewerId);
        return messages.stream()
                .map(m -> MessageDto.of(m, chatId, viewerId,
                        m.isTombstoned() ? List.of() : reactions.getOrDefault(m.getId(), List.of())))
                .toList();
    }

    /* ---------- conversations ---------- */

    @Transactional
    public ChatSummaryDto findOrCreateDirect(Long requesterId, Long otherUserId) {
        if (requesterId.equals(otherUserId)) {
            throw ChatException.invalid("You cannot start a chat with yourself");
        }
        if (!userRepository.existsById(otherUserId)) {
            throw ChatException.notFound("User not found");
        }

        Long chatId = directConversationResolver.resolve(requesterId, otherUserId);
        Conversation conversation = requireConversation(chatId);
        return project(conversation, requesterId);
    }

    @Transactional
    public ChatSummaryDto createGroup(Long creatorId, Collection<Long> memberIds, String name) {
        User creator = requireUser(creatorId);
        Set<Long> ids = new LinkedHashSet<>();
        memberIds.stream().filter(Objects::nonNull).forEach(ids::add);
        ids.remove(creatorId);
        if (ids.isEmpty()) {
            throw ChatException.invalid("A group needs at least one other member");
        }
        List<User> members = requireUsers(ids);

        Conversation group = Conversation.group(StringUtils.hasText(name) ? name.trim() : null);
        group.addParticipant(new Participant(creator, ParticipantRole.ADMIN));
        members.forEach(u -> group.addParticipant(new Participant(u, ParticipantRole.MEMBER)));
        conversationRepository.save(group);

        log.info("User {} created group {} with {} members", creatorId, group.getId(), ids.size());
        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.ADDED_TO_GROUP, group.getId(), null), ids);
        return project(group, creatorId);
    }

    /* ---------- messages ---------- */

    @Transactional
    public MessageDto sendMessage(Long senderId, Long chatId, String text, List<MultipartFile> files) {
        List<MultipartFile> uploads = files == null
                ? List.of()
                : files.stream().filter(f -> f != null && !f.isEmpty()).toList();
        String content = StringUtils.hasText(text) ? text : null;
        if (content == null && uploads.isEmpty()) {
            throw ChatException.invalid("Message must contain text or at least one attachment");
        }

        Conversation conversation = requireConversation(chatId);
        List<Long> participantIds = participantRepository.findUserIds(chatId);
        if (!participantIds.contains(senderId)) {
            throw ChatException.forbidden("You are not a participant of this chat");
        }
        moderationGuard.requireCanSend(senderId, participantIds);
        for (MultipartFile f : uploads) {
            if (f.getSize() > maxFileSizeBytes) {
                throw ChatException.invalid("File " + f.getOriginalFilename() + " exceeds the "
                        + (maxFileSizeBytes / (1024 * 1024)) + " MB limit");
            }
        }

        Message message = new Message();
        message.setConversation(conversation);
        message.setSender(requireUser(senderId));
        message.setContent(content);
        message.setType(MessageType.infer(uploads.stream().map(MultipartFile::getContentType).toList()));
        List<StoredFile> storedFiles = store(uploads);
        deleteFilesOnRollback(storedFiles.stream().map(StoredFile::key).toList());
        for (StoredFile stored : storedFiles) {
            Attachment a = new Attachment();
            a.setUrl(stored.url());
            a.setStorageKey(stored.key());
            a.setMimeType(stored.contentType());
            a.setFileName(stored.filename());
            a.setSizeBytes(stored.size());
            message.addAttachment(a);
        }
        messageRepository.save(message);
        conversation.touch(message.getCreatedAt());

        log.debug("User {} sent message {} to chat {} ({} attachments)",
                senderId, message.getId(), chatId, uploads.size());
        eventRouter.deliverAfterCommit(new MessageEvent(MessageDto.broadcast(message, chatId)), participantIds);
        return MessageDto.of(message, chatId, senderId, List.of());
    }

    /** Tombstones the message. Deleting an already recalled message succeeds without effect. */
    @Transactional
    public void deleteMessage(Long requesterId, Long chatId, Long messageId) {
        requireConversation(chatId);
        requireParticipant(chatId, requesterId);
        Message message = messageRepository.findByIdAndConversationId(messageId, chatId)
                .orElseThrow(() -> ChatException.notFound("Message not found"));
        if (!requesterId.equals(message.getSenderId())) {
            throw ChatException.forbidden("You can only delete your own messages");
        }

        List<String> storedFiles = message.getAttachments().stream()
                .map(a -> a.getStorageKey() != null ? a.getStorageKey() : a.getUrl())
                .toList();
        if (!message.tombstone(Instant.now())) {
            return;
        }

        log.info("User {} recalled message {} in chat {}", requesterId, messageId, chatId);
        deleteFilesAfterCommit(storedFiles);
        eventRouter.deliverAfterCommit(MessageUpdateEvent.recalled(messageId, chatId),
                participantRepository.findUserIds(chatId));
    }

    @Transactional
    public ReactionResult toggleReaction(Long userId, Long chatId, Long messageId, String emoji) {
        if (!StringUtils.hasText(emoji)) {
            throw ChatException.invalid("Emoji is required");
        }
        String normalized = emoji.trim();
        requireConversation(chatId);
        List<Long> participantIds = participantRepository.findUserIds(chatId);
        if (!participantIds.contains(userId)) {
            throw ChatException.forbidden("You are not a participant of this chat");
        }
        Message message = messageRepository.findByIdAndConversationId(messageId, chatId)
                .orElseThrow(() -> ChatException.notFound("Message not found"));
        if (message.isTombstoned()) {
            throw ChatException.invalid("Cannot react to a recalled message");
        }

        ReactionAction action = reactionRepository.findByMessageIdAndUserIdAndEmoji(messageId, userId, normalized)
                .map(existing -> {
                    reactionRepository.delete(existing);
                    return ReactionAction.REMOVED;
                })
                .orElseGet(() -> {
                    reactionRepository.save(new MessageReaction(message, userRepository.getReferenceById(userId), normalized));
                    return ReactionAction.ADDED;
                });
        reactionRepository.flush();
        long count = reactionRepository.countByMessageIdAndEmoji(messageId, normalized);

        eventRouter.deliverAfterCommit(
                new ReactionUpdateEvent(messageId, chatId, normalized, action, userId, count), participantIds);
        return new ReactionResult(messageId, normalized, action, count);
    }

    /* ---------- membership ---------- */

    @Transactional
    public void markRead(Long userId, Long chatId) {
        requireConversation(chatId);
        Participant self = requireParticipant(chatId, userId);
        self.advanceReadCursor(Instant.now());
    }

    @Transactional
    public void leaveGroup(Long userId, Long chatId) {
        Conversation conversation = requireGroup(chatId, "You cannot leave a direct chat");
        Participant self = requireParticipant(chatId, userId);
        String leaverName = self.getUser().getUsername();
        boolean wasAdmin = self.hasRole(ParticipantRole.ADMIN);

        conversation.getParticipants().remove(self);
        List<Participant> remaining = conversation.getParticipants();
        if (remaining.isEmpty()) {
            conversationRepository.delete(conversation);
            log.info("Group {} removed after its last member {} left", chatId, userId);
            return;
        }
        if (wasAdmin && remaining.stream().noneMatch(p -> p.hasRole(ParticipantRole.ADMIN))) {
            Participant successor = remaining.get(0);
            successor.setRole(ParticipantRole.ADMIN);
            log.info("User {} promoted to admin of group {}", successor.getUserId(), chatId);
        }

        List<Long> remainingIds = userIds(remaining);
        log.info("User {} left group {}", userId, chatId);
        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.MEMBER_REMOVED, chatId, userId), remainingIds);
        Message notice = appendSystemMessage(conversation, leaverName + " has left the group");
        eventRouter.deliverAfterCommit(new MessageEvent(MessageDto.broadcast(notice, chatId)), remainingIds);
    }

    @Transactional
    public void kickMember(Long adminId, Long chatId, Long targetId) {
        Conversation conversation = requireGroup(chatId, "Members can only be removed from group chats");
        Participant admin = requireParticipant(chatId, adminId);
        requireRole(admin, ParticipantRole.ADMIN);
        if (adminId.equals(targetId)) {
            throw ChatException.invalid("You cannot remove yourself; leave the group instead");
        }
        Participant target = participantRepository.findByConversationIdAndUserId(chatId, targetId)
                .orElseThrow(() -> ChatException.notFound("User is not a member of this chat"));

        String text = admin.getUser().getUsername() + " removed " + target.getUser().getUsername();
        conversation.getParticipants().remove(target);
        List<Long> remainingIds = userIds(conversation.getParticipants());

        log.info("Admin {} removed user {} from group {}", adminId, targetId, chatId);
        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.USER_KICKED, chatId, targetId), List.of(targetId));
        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.MEMBER_REMOVED, chatId, targetId), remainingIds);
        Message notice = appendSystemMessage(conversation, text);
        eventRouter.deliverAfterCommit(new MessageEvent(MessageDto.broadcast(notice, chatId)), remainingIds);
    }

    /** Adds the users that are not members yet and returns their profiles. */
    @Transactional
    public List<UserSummaryDto> addMembers(Long adminId, Long chatId, Collection<Long> userIds) {
        Conversation conversation = requireGroup(chatId, "Members can only be added to group chats");
        Participant admin = requireParticipant(chatId, adminId);
        requireRole(admin, ParticipantRole.ADMIN);

        List<Long> existingIds = userIds(conversation.getParticipants());
        Set<Long> toAdd = new LinkedHashSet<>();
        userIds.stream().filter(Objects::nonNull).forEach(toAdd::add);
        toAdd.removeAll(existingIds);
        if (toAdd.isEmpty()) {
            return List.of();
        }

        List<User> added = requireUsers(toAdd).stream()
                .filter(u -> insertMember(chatId, u.getId()))
                .toList();
        if (added.isEmpty()) {
            return List.of();
        }
        List<Long> addedIds = added.stream().map(User::getId).toList();
        List<UserSummaryDto> profiles = added.stream().map(UserSummaryDto::from).toList();
        String names = added.stream().map(User::getUsername).collect(Collectors.joining(", "));

        log.info("Admin {} added {} to group {}", adminId, addedIds, chatId);
        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.ADDED_TO_GROUP, chatId, null), addedIds);
        eventRouter.deliverAfterCommit(GroupEvent.membersAdded(chatId, profiles), existingIds);
        Message notice = appendSystemMessage(conversation, admin.getUser().getUsername() + " added " + names);
        List<Long> everyone = new ArrayList<>(existingIds);
        everyone.addAll(addedIds);
        eventRouter.deliverAfterCommit(new MessageEvent(MessageDto.broadcast(notice, chatId)), everyone);
        return profiles;
    }

    /** False when the user joined concurrently through another request. */
    private boolean insertMember(Long chatId, Long userId) {
        return uniqueRowWriter.insert(() -> {
            Participant member = new Participant(userRepository.getReferenceById(userId), ParticipantRole.MEMBER);
            member.setConversation(conversationRepository.getReferenceById(chatId));
            participantRepository.saveAndFlush(member);
        }, () -> participantRepository.findByConversationIdAndUserId(chatId, userId).isPresent());
    }

    @Transactional
    public void dissolveGroup(Long adminId, Long chatId) {
        Conversation conversation = requireGroup(chatId, "Only group chats can be dissolved");
        Participant admin = requireParticipant(chatId, adminId);
        requireRole(admin, ParticipantRole.ADMIN);

        List<Long> participantIds = userIds(conversation.getParticipants());
        List<String> storedFiles = conversation.getMessages().stream()
                .flatMap(m -> m.getAttachments().stream())
                .map(a -> a.getStorageKey() != null ? a.getStorageKey() : a.getUrl())
                .toList();

        eventRouter.deliverAfterCommit(GroupEvent.of(GroupEventKind.GROUP_DISSOLVED, chatId, adminId), participantIds);
        conversationRepository.delete(conversation);
        deleteFilesAfterCommit(storedFiles);
        log.info("Admin {} dissolved group {} ({} members)", adminId, chatId, participantIds.size());
    }

    /* ---------- helpers ---------- */

    private static void requireRole(Participant participant, ParticipantRole role) {
        if (!participant.hasRole(role)) {
            throw ChatException.forbidden("Only group " + role.wireName() + "s can do this");
        }
    }

    private Conversation requireConversation(Long chatId) {
        return conversationRepository.findById(chatId)
                .orElseThrow(() -> ChatException.notFound("Chat not found"));
    }

    private Conversation requireGroup(Long chatId, String notGroupMessage) {
        Conversation conversation = requireConversation(chatId);
        if (!conversation.isGroup()) {
            throw ChatException.invalid(notGroupMessage);
        }
        return conversation;
    }

    private Participant requireParticipant(Long chatId, Long userId) {
        return participantRepository.findByConversationIdAndUserId(chatId, userId)
                .orElseThrow(() -> ChatException.forbidden("You are not a participant of this chat"));
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ChatException.notFound("User not found"));
    }

    // keeps the caller's order
    private List<User> requireUsers(Collection<Long> ids) {
        Map<Long, User> byId = userRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        List<User> users = new ArrayList<>(ids.size());
        for (Long id : ids) {
            User u = byId.get(id);
            if (u == null) {
                throw ChatException.notFound("User " + id + " not found");
            }
            users.add(u);
        }
        return users;
    }

    private static List<Long> userIds(Collection<Participant> participants) {
        return participants.stream().map(Participant::getUserId).toList();
    }

    private Message appendSystemMessage(Conversation conversation, String text) {
        Message notice = messageRepository.save(Message.system(conversation, text));
        conversation.touch(notice.getCreatedAt());
        return notice;
    }

    private ChatSummaryDto project(Conversation conversation, Long viewerId) {
        return viewProjector.project(snapshot(conversation, viewerId), viewerId, moderationGuard.blockerIdsOf(viewerId));
    }

    private ChatSnapshot snapshot(Conversation conversation, Long viewerId) {
        List<Participant> participants = List.copyOf(conversation.getParticipants());
        Message last = conversation.getId() == null
                ? null
                : messageRepository.findFirstByConversationIdOrderByCreatedAtDescIdDesc(conversation.getId()).orElse(null);
        List<Message> recent = participants.stream()
                .filter(p -> viewerId.equals(p.getUserId()))
                .findFirst()
                .map(self -> messageRepository.findByConversationIdAndCreatedAtAfterOrderByCreatedAtDescIdDesc(
                        conversation.getId(), self.getLastReadAt(), PageRequest.of(0, unreadWindow)))
                .orElse(List.of());
        return new ChatSnapshot(conversation, participants, last, recent);
    }

    private Map<Long, List<ReactionCountDto>> reactionCounts(List<Long> messageIds, Long viewerId) {
        Map<Long, Map<String, Long>> counts = new HashMap<>();
        Map<Long, Set<String>> mine = new HashMap<>();
        for (MessageReaction r : reactionRepository.findByMessageIdIn(messageIds)) {
            Long messageId = r.getMessage().getId();
            counts.computeIfAbsent(messageId, k -> new LinkedHashMap<>()).merge(r.getEmoji(), 1L, Long::sum);
            if (viewerId.equals(r.getUser().getId())) {
                mine.computeIfAbsent(messageId, k -> new HashSet<>()).add(r.getEmoji());
            }
        }

        Map<Long, List<ReactionCountDto>> result = new HashMap<>();
        counts.forEach((messageId, perEmoji) -> result.put(messageId, perEmoji.entrySet().stream()
                .map(e -> new ReactionCountDto(e.getKey(), e.getValue(),
                        mine.getOrDefault(messageId, Set.of()).contains(e.getKey())))
                .toList()));
        return result;
    }

    private List<StoredFile> store(List<MultipartFile> uploads) {
        List<StoredFile> stored = new ArrayList<>(uploads.size());
        try {
            for (MultipartFile f : uploads) {
                stored.add(storageService.save(f, ATTACHMENT_FOLDER));
            }
            return stored;
        } catch (IOException e) {
            stored.forEach(s -> deleteStoredFile(s.key()));
            log.error("Failed to store attachment", e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store attachment", e);
        }
    }

    private void deleteFilesAfterCommit(List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            keys.forEach(this::deleteStoredFile);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                keys.forEach(ConversationService.this::deleteStoredFile);
            }
        });
    }

    private void deleteFilesOnRollback(List<String> keys) {
        if (keys.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    log.info("Removing {} attachments of a message that was not saved", keys.size());
                    keys.forEach(ConversationService.this::deleteStoredFile);
                }
            }
        });
    }

    private void deleteStoredFile(String key) {
        try {
            storageService.delete(key);
        } catch (IOException e) {
            log.warn("Failed to delete stored attachment {}: {}", key, e.getMessage());
        }
    }
}
