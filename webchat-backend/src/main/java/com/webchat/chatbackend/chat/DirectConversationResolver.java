package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Finds or creates the single direct conversation of a user pair. The unique
 * {@code direct_key} column is the serialization point: the insert runs in its
 * own transaction and a loser of a concurrent race re-reads the winner's row.
 */
@Component
@Slf4j
public class DirectConversationResolver {

    private final ConversationRepository conversationRepository;
    private final UserRepository userRepository;
    private final TransactionTemplate insertTransaction;

    public DirectConversationResolver(ConversationRepository conversationRepository,
                                      UserRepository userRepository,
                                      PlatformTransactionManager transactionManager) {
        this.conversationRepository = conversationRepository;
        this.userRepository = userRepository;
        this.insertTransaction = new TransactionTemplate(transactionManager);
        this.insertTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /** Returns the id of the direct conversation between the two users. Both users must exist. */
    public Long resolve(Long userA, Long userB) {
        String key = Conversation.directKey(userA, userB);
        Optional<Long> existing = findId(key);
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            Long id = insertTransaction.execute(status -> {
                Conversation c = Conversation.direct(userA, userB);
                c.addParticipant(new Participant(userRepository.getReferenceById(userA), ParticipantRole.MEMBER));
                c.addParticipant(new Participant(userRepository.getReferenceById(userB), ParticipantRole.MEMBER));
                return conversationRepository.saveAndFlush(c).getId();
            });
            log.info("Created direct conversation {} for pair {}", id, key);
            return id;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Direct conversation {} was created concurrently, reusing it", key);
            return findId(key).orElseThrow(() -> e);
        }
    }

    private Optional<Long> findId(String key) {
        return conversationRepository.findByDirectKey(key).map(Conversation::getId);
    }
}
