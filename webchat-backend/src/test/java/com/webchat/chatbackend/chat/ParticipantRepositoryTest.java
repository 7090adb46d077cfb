package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.realtime.EventRouter;
import com.webchat.chatbackend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ParticipantRepositoryTest {

    @Autowired private ConversationService conversationService;
    @Autowired private ParticipantRepository participantRepository;
    @Autowired private TestCleanupService cleanup;

    @MockBean private EventRouter eventRouter;

    private Long alice;
    private Long bob;
    private Long carol;
    private Long chat;

    @BeforeEach
    void setUp() {
        cleanup.deleteAll();
        alice = cleanup.createUser("alice").getId();
        bob = cleanup.createUser("bob").getId();
        carol = cleanup.createUser("carol").getId();
        chat = conversationService.createGroup(alice, List.of(bob), "Team").id();
    }

    @Test
    void membershipLookupMatchesOnConversationAndUser() {
        Participant admin = participantRepository.findByConversationIdAndUserId(chat, alice).orElseThrow();
        Participant member = participantRepository.findByConversationIdAndUserId(chat, bob).orElseThrow();

        assertEquals(ParticipantRole.ADMIN, admin.getRole());
        assertEquals(ParticipantRole.MEMBER, member.getRole());
        assertTrue(participantRepository.findByConversationIdAndUserId(chat, carol).isEmpty());
        assertTrue(participantRepository.findByConversationIdAndUserId(chat + 1000, alice).isEmpty());
    }

    @Test
    void userIdsAndCountCoverEveryMember() {
        assertEquals(Set.of(alice, bob), Set.copyOf(participantRepository.findUserIds(chat)));
        assertEquals(2, participantRepository.countByConversationId(chat));
    }
}
