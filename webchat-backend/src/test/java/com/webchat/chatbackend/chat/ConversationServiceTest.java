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
import com.webchat.chatbackend.realtime.event.RealtimeEvent;
import com.webchat.chatbackend.shared.ChatErrorKind;
import com.webchat.chatbackend.shared.ChatException;
import com.webchat.chatbackend.storage.FakeStorageService;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import com.webchat.chatbackend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SpringBootTest
class ConversationServiceTest {

    @Autowired private ConversationService conversationService;
    @Autowired private ModerationGuard moderationGuard;
    @Autowired private ConversationRepository conversationRepository;
    @Autowired private ParticipantRepository participantRepository;
    @Autowired private MessageRepository messageRepository;
    @Autowired private FakeStorageService storage;
    @Autowired private TestCleanupService cleanup;
    @Autowired private PlatformTransactionManager transactionManager;

    @MockBean private EventRouter eventRouter;

    private Long alice;
    private Long bob;
    private Long carol;

    @BeforeEach
    void setUp() {
        cleanup.deleteAll();
        storage.clear();
        alice = cleanup.createUser("alice").getId();
        bob = cleanup.createUser("bob").getId();
        carol = cleanup.createUser("carol").getId();
    }

    private static void assertKind(ChatErrorKind expected, Executable call) {
        ChatException ex = assertThrows(ChatException.class, call);
        assertEquals(expected, ex.getKind());
    }

    private static MockMultipartFile file(String name, String contentType, int size) {
        return new MockMultipartFile("files", name, contentType, new byte[size]);
    }

    /** Every (event, targets) pair handed to the router so far, in order. */
    @SuppressWarnings("unchecked")
    private List<Map.Entry<RealtimeEvent, Set<Long>>> deliveries() {
        ArgumentCaptor<RealtimeEvent> events = ArgumentCaptor.forClass(RealtimeEvent.class);
        ArgumentCaptor<Collection<Long>> targets = ArgumentCaptor.forClass(Collection.class);
        verify(eventRouter, atLeast(0)).deliverAfterCommit(events.capture(), targets.capture());
        List<Map.Entry<RealtimeEvent, Set<Long>>> result = new ArrayList<>();
        for (int i = 0; i < events.getAllValues().size(); i++) {
            result.add(new AbstractMap.SimpleEntry<>(events.getAllValues().get(i), new HashSet<>(targets.getAllValues().get(i))));
        }
        return result;
    }

    private Long group(Long creator, List<Long> members) {
        Long id = conversationService.createGroup(creator, members, "Team").id();
        clearInvocations(eventRouter);
        return id;
    }

    private void setReadCursor(Long chatId, Long userId, Instant at) {
        Participant p = participantRepository.findByConversationIdAndUserId(chatId, userId).orElseThrow();
        p.setLastReadAt(at);
        participantRepository.save(p);
    }

    private long unreadFor(Long userId, Long chatId) {
        return conversationService.getUserChats(userId).stream()
                .filter(c -> c.id().equals(chatId))
                .findFirst()
                .orElseThrow()
                .unreadCount();
    }

    /* ---------- direct chats ---------- */

    @Test
    void findOrCreateDirectIsIdempotentAndSymmetric() {
        ChatSummaryDto first = conversationService.findOrCreateDirect(alice, bob);
        ChatSummaryDto again = conversationService.findOrCreateDirect(alice, bob);
        ChatSummaryDto reversed = conversationService.findOrCreateDirect(bob, alice);

        assertEquals(first.id(), again.id());
        assertEquals(first.id(), reversed.id());
        assertEquals(1, conversationRepository.count());
        assertEquals(2, participantRepository.countByConversationId(first.id()));
        assertEquals("bob", first.name());
        assertEquals("alice", reversed.name());
    }

    @Test
    void findOrCreateDirectRejectsSelfAndUnknownUsers() {
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.findOrCreateDirect(alice, alice));
        assertKind(ChatErrorKind.NOT_FOUND, () -> conversationService.findOrCreateDirect(alice, 999_999L));
        assertEquals(0, conversationRepository.count());
    }

    /* ---------- groups ---------- */

    @Test
    void createGroupDeduplicatesAndMakesOnlyTheCreatorAdmin() {
        ChatSummaryDto group = conversationService.createGroup(alice, List.of(bob, bob, alice, carol), "  Team  ");

        assertEquals(ConversationKind.GROUP, group.kind());
        assertEquals("Team", group.name());
        assertEquals(ParticipantRole.ADMIN, group.role());
        assertEquals(3, participantRepository.countByConversationId(group.id()));
        assertEquals(ParticipantRole.MEMBER, conversationService.getChat(bob, group.id()).role());
        assertEquals(ParticipantRole.MEMBER, conversationService.getChat(carol, group.id()).role());

        verify(eventRouter).deliverAfterCommit(
                eq(GroupEvent.of(GroupEventKind.ADDED_TO_GROUP, group.id(), null)), eq(Set.of(bob, carol)));
    }

    @Test
    void createGroupNeedsAnotherMember() {
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.createGroup(alice, List.of(alice), "Solo"));
        assertKind(ChatErrorKind.NOT_FOUND, () -> conversationService.createGroup(alice, List.of(bob, 999_999L), "Ghost"));
        assertEquals(0, conversationRepository.count());
    }

    /* ---------- sending ---------- */

    @Test
    void messageTypeIsInferredFromAttachments() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();

        MessageDto text = conversationService.sendMessage(alice, chat, "hello", null);
        MessageDto images = conversationService.sendMessage(alice, chat, null,
                List.of(file("a.png", "image/png", 10), file("b.jpg", "image/jpeg", 10)));
        MessageDto mixed = conversationService.sendMessage(alice, chat, "see attached",
                List.of(file("a.png", "image/png", 10), file("c.pdf", "application/pdf", 10)));

        assertEquals(MessageType.TEXT, text.messageType());
        assertEquals(MessageType.IMAGE, images.messageType());
        assertEquals(MessageType.FILE, mixed.messageType());
        assertEquals(2, mixed.attachments().size());
        assertEquals("c.pdf", mixed.attachments().get(1).fileName());
        assertEquals(4, storage.size());
        assertFalse(text.incoming());
    }

    @Test
    void sendBroadcastsToEveryParticipantIncludingTheSender() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();

        MessageDto sent = conversationService.sendMessage(alice, chat, "hello", null);

        List<Map.Entry<RealtimeEvent, Set<Long>>> sentEvents = deliveries();
        assertEquals(1, sentEvents.size());
        assertEquals(Set.of(alice, bob), sentEvents.get(0).getValue());
        MessageEvent messageEvent = assertInstanceOf(MessageEvent.class, sentEvents.get(0).getKey());
        assertEquals(sent.id(), messageEvent.message().id());
        assertEquals("alice", messageEvent.message().senderName());
        assertNull(messageEvent.message().incoming());
    }

    @Test
    void emptyMessageIsRejectedBeforeAnythingIsWritten() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();

        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.sendMessage(alice, chat, "   ", List.of()));
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () ->
                conversationService.sendMessage(alice, chat, null, List.<MultipartFile>of(file("empty.txt", "text/plain", 0))));
        assertEquals(0, messageRepository.count());
    }

    @Test
    void oversizedAttachmentIsRejected() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();

        assertKind(ChatErrorKind.INVALID_ARGUMENT, () ->
                conversationService.sendMessage(alice, chat, "big", List.of(file("big.bin", "application/octet-stream", 4096))));
        assertEquals(0, messageRepository.count());
        assertEquals(0, storage.size());
    }

    @Test
    void attachmentsOfARolledBackSendAreRemoved() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        tx.executeWithoutResult(status -> {
            conversationService.sendMessage(alice, chat, "see attached",
                    List.of(file("a.png", "image/png", 10), file("c.pdf", "application/pdf", 10)));
            assertEquals(2, storage.size());
            status.setRollbackOnly();
        });

        assertEquals(0, storage.size());
        assertEquals(0, messageRepository.count());
    }

    @Test
    void outsidersCannotSend() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();

        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.sendMessage(carol, chat, "hi", null));
        assertKind(ChatErrorKind.NOT_FOUND, () -> conversationService.sendMessage(alice, 999_999L, "hi", null));
    }

    @Test
    void blockedSenderWritesNothingAndBroadcastsNothing() {
        moderationGuard.blockUser(bob, alice);
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        clearInvocations(eventRouter);

        assertKind(ChatErrorKind.BLOCKED, () -> conversationService.sendMessage(alice, chat, "hi", null));

        assertEquals(0, messageRepository.count());
        verifyNoInteractions(eventRouter);
        assertTrue(conversationService.getUserChats(alice).get(0).blockedBy());
        // the blocker can still write
        assertDoesNotThrow(() -> conversationService.sendMessage(bob, chat, "bye", null));
    }

    /* ---------- deleting ---------- */

    @Test
    void deleteIsIdempotentAndLeavesATombstone() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        MessageDto sent = conversationService.sendMessage(alice, chat, "oops",
                List.of(file("a.png", "image/png", 10)));
        assertEquals(1, storage.size());
        clearInvocations(eventRouter);

        conversationService.deleteMessage(alice, chat, sent.id());
        assertDoesNotThrow(() -> conversationService.deleteMessage(alice, chat, sent.id()));

        MessageDto tombstone = conversationService.getMessages(bob, chat, null).get(0);
        assertEquals(sent.id(), tombstone.id());
        assertEquals(alice, tombstone.senderId());
        assertNotNull(tombstone.createdAt());
        assertTrue(tombstone.recalled());
        assertNull(tombstone.text());
        assertTrue(tombstone.attachments().isEmpty());
        assertEquals(0, storage.size());
        assertEquals(1, messageRepository.count());

        verify(eventRouter, times(1)).deliverAfterCommit(eq(MessageUpdateEvent.recalled(sent.id(), chat)), anyCollection());
    }

    @Test
    void onlyTheSenderMayDelete() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        MessageDto sent = conversationService.sendMessage(alice, chat, "mine", null);

        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.deleteMessage(bob, chat, sent.id()));
        assertKind(ChatErrorKind.NOT_FOUND, () -> conversationService.deleteMessage(alice, chat, 999_999L));
    }

    /* ---------- reactions ---------- */

    @Test
    void toggleReactionRoundTrips() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        MessageDto sent = conversationService.sendMessage(alice, chat, "nice", null);

        ReactionResult added = conversationService.toggleReaction(bob, chat, sent.id(), "👍");
        assertEquals(ReactionAction.ADDED, added.action());
        assertEquals(1, added.count());
        assertEquals(List.of(new ReactionCountDto("👍", 1, true)),
                conversationService.getMessages(bob, chat, null).get(0).reactions());
        assertEquals(List.of(new ReactionCountDto("👍", 1, false)),
                conversationService.getMessages(alice, chat, null).get(0).reactions());

        ReactionResult removed = conversationService.toggleReaction(bob, chat, sent.id(), "👍");
        assertEquals(ReactionAction.REMOVED, removed.action());
        assertEquals(0, removed.count());
        assertTrue(conversationService.getMessages(bob, chat, null).get(0).reactions().isEmpty());

        assertTrue(deliveries().contains(Map.entry(
                new ReactionUpdateEvent(sent.id(), chat, "👍", ReactionAction.REMOVED, bob, 0), Set.of(alice, bob))));
    }

    @Test
    void reactionsOnRecalledMessagesAreRejected() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        MessageDto sent = conversationService.sendMessage(alice, chat, "gone", null);
        conversationService.deleteMessage(alice, chat, sent.id());

        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.toggleReaction(bob, chat, sent.id(), "👍"));
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.toggleReaction(bob, chat, sent.id(), " "));
    }

    /* ---------- read cursor ---------- */

    @Test
    void unreadCountFollowsTheReadCursor() {
        Long chat = group(alice, List.of(bob));
        setReadCursor(chat, bob, Instant.now().minus(Duration.ofHours(1)));

        conversationService.sendMessage(alice, chat, "hi", null);

        assertEquals(1, unreadFor(bob, chat));
        assertEquals(0, unreadFor(alice, chat));

        conversationService.markRead(bob, chat);
        assertEquals(0, unreadFor(bob, chat));
    }

    @Test
    void markReadNeverMovesTheCursorBackwards() {
        Long chat = group(alice, List.of(bob));
        Instant future = Instant.now().plus(Duration.ofDays(1)).truncatedTo(ChronoUnit.SECONDS);
        setReadCursor(chat, bob, future);

        conversationService.markRead(bob, chat);

        Instant cursor = participantRepository.findByConversationIdAndUserId(chat, bob).orElseThrow().getLastReadAt();
        assertEquals(future, cursor);
        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.markRead(carol, chat));
    }

    /* ---------- membership ---------- */

    @Test
    void kickNotifiesTargetAndRemainingMembersSeparately() {
        Long chat = group(alice, List.of(bob, carol));

        conversationService.kickMember(alice, chat, bob);

        List<Map.Entry<RealtimeEvent, Set<Long>>> sent = deliveries();
        assertTrue(sent.contains(Map.entry(GroupEvent.of(GroupEventKind.USER_KICKED, chat, bob), Set.of(bob))));
        assertTrue(sent.contains(Map.entry(GroupEvent.of(GroupEventKind.MEMBER_REMOVED, chat, bob), Set.of(alice, carol))));
        assertTrue(sent.stream().anyMatch(e -> e.getKey() instanceof MessageEvent m
                && "alice removed bob".equals(m.message().text())
                && m.message().senderId() == null
                && e.getValue().equals(Set.of(alice, carol))));

        assertTrue(conversationService.getUserChats(bob).stream().noneMatch(c -> c.id().equals(chat)));
        assertTrue(conversationService.getUserChats(carol).stream().anyMatch(c -> c.id().equals(chat)));
        MessageDto notice = conversationService.getMessages(carol, chat, null).get(0);
        assertEquals(MessageType.SYSTEM, notice.messageType());
        assertEquals(MessageDto.SYSTEM_SENDER_NAME, notice.senderName());
        assertFalse(notice.incoming());
    }

    @Test
    void kickRules() {
        Long chat = group(alice, List.of(bob));
        Long direct = conversationService.findOrCreateDirect(alice, carol).id();

        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.kickMember(bob, chat, alice));
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.kickMember(alice, chat, alice));
        assertKind(ChatErrorKind.NOT_FOUND, () -> conversationService.kickMember(alice, chat, carol));
        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.kickMember(alice, direct, carol));
        assertEquals(2, participantRepository.countByConversationId(chat));
    }

    @Test
    void addMembersSkipsExistingAndDifferentiatesSignals() {
        Long chat = group(alice, List.of(bob));

        List<UserSummaryDto> added = conversationService.addMembers(alice, chat, List.of(bob, carol));

        assertEquals(List.of(carol), added.stream().map(UserSummaryDto::id).toList());
        assertEquals(3, participantRepository.countByConversationId(chat));

        List<Map.Entry<RealtimeEvent, Set<Long>>> sent = deliveries();
        assertTrue(sent.contains(Map.entry(GroupEvent.of(GroupEventKind.ADDED_TO_GROUP, chat, null), Set.of(carol))));
        assertTrue(sent.contains(Map.entry(GroupEvent.membersAdded(chat, added), Set.of(alice, bob))));
        assertTrue(sent.stream().anyMatch(e -> e.getKey() instanceof MessageEvent m
                && "alice added carol".equals(m.message().text())));

        clearInvocations(eventRouter);
        assertTrue(conversationService.addMembers(alice, chat, List.of(bob, carol)).isEmpty());
        verifyNoInteractions(eventRouter);
        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.addMembers(bob, chat, List.of(carol)));
    }

    @Test
    void leavingADirectChatIsInvalid() {
        Long direct = conversationService.findOrCreateDirect(alice, bob).id();

        assertKind(ChatErrorKind.INVALID_ARGUMENT, () -> conversationService.leaveGroup(alice, direct));
    }

    @Test
    void leavingAdminHandsOverToTheEarliestMember() {
        Long chat = group(alice, List.of(bob, carol));

        conversationService.leaveGroup(alice, chat);

        assertEquals(ParticipantRole.ADMIN, conversationService.getChat(bob, chat).role());
        assertEquals(ParticipantRole.MEMBER, conversationService.getChat(carol, chat).role());
        assertEquals("alice has left the group", conversationService.getMessages(bob, chat, null).get(0).text());
        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.getChat(alice, chat));
    }

    @Test
    void lastMemberLeavingRemovesTheGroup() {
        Long chat = group(alice, List.of(bob));
        conversationService.sendMessage(bob, chat, "bye", null);

        conversationService.leaveGroup(bob, chat);
        conversationService.leaveGroup(alice, chat);

        assertFalse(conversationRepository.existsById(chat));
        assertEquals(0, messageRepository.count());
    }

    @Test
    void dissolveNotifiesEveryoneAndRemovesEverything() {
        Long chat = group(alice, List.of(bob, carol));
        MessageDto sent = conversationService.sendMessage(bob, chat, "pic", List.of(file("a.png", "image/png", 10)));
        conversationService.toggleReaction(carol, chat, sent.id(), "🎉");
        clearInvocations(eventRouter);

        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.dissolveGroup(bob, chat));
        conversationService.dissolveGroup(alice, chat);

        assertTrue(deliveries().contains(Map.entry(
                GroupEvent.of(GroupEventKind.GROUP_DISSOLVED, chat, alice), Set.of(alice, bob, carol))));
        assertFalse(conversationRepository.existsById(chat));
        assertEquals(0, participantRepository.count());
        assertEquals(0, messageRepository.count());
        assertEquals(0, storage.size());
        assertTrue(conversationService.getUserChats(bob).isEmpty());
    }

    /* ---------- history ---------- */

    @Test
    void searchMatchesLiveMessagesCaseInsensitively() {
        Long chat = conversationService.findOrCreateDirect(alice, bob).id();
        conversationService.sendMessage(alice, chat, "Hello world", null);
        conversationService.sendMessage(bob, chat, "bye", null);
        MessageDto recalled = conversationService.sendMessage(bob, chat, "hello again", null);
        conversationService.deleteMessage(bob, chat, recalled.id());

        List<MessageDto> found = conversationService.getMessages(alice, chat, "HELLO");

        assertEquals(1, found.size());
        assertEquals("Hello world", found.get(0).text());
        assertFalse(found.get(0).incoming());
        assertEquals(3, conversationService.getMessages(alice, chat, "  ").size());
        assertKind(ChatErrorKind.FORBIDDEN, () -> conversationService.getMessages(carol, chat, null));
    }

    @Test
    void chatListIsOrderedByLatestActivity() {
        Long withBob = conversationService.findOrCreateDirect(alice, bob).id();
        Long withCarol = conversationService.findOrCreateDirect(alice, carol).id();
        conversationService.sendMessage(bob, withBob, "ping", null);

        List<ChatSummaryDto> chats = conversationService.getUserChats(alice);

        assertEquals(List.of(withBob, withCarol), chats.stream().map(ChatSummaryDto::id).toList());
        assertEquals("ping", chats.get(0).lastMessage());
    }
}
