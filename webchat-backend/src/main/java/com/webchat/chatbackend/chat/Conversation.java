package com.webchat.chatbackend.chat;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "conversations")
public class Conversation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ConversationKind kind;

    @Column(length = 100)
    private String name;

    // "minUserId:maxUserId" for direct chats, null for groups; one direct chat per pair
    @Column(name = "direct_key", unique = true, length = 64)
    private String directKey;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    @Column(nullable = false)
    private Instant lastMessageAt = Instant.now();

    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC, id ASC")
    private List<Participant> participants = new ArrayList<>();

    @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Message> messages = new ArrayList<>();

    public static Conversation direct(Long userA, Long userB) {
        Conversation c = new Conversation();
        c.setKind(ConversationKind.DIRECT);
        c.setDirectKey(directKey(userA, userB));
        return c;
    }

    public static Conversation group(String name) {
        Conversation c = new Conversation();
        c.setKind(ConversationKind.GROUP);
        c.setName(name);
        return c;
    }

    public static String directKey(Long userA, Long userB) {
        long low = Math.min(userA, userB);
        long high = Math.max(userA, userB);
        return low + ":" + high;
    }

    public boolean isGroup() {
        return kind == ConversationKind.GROUP;
    }

    public void addParticipant(Participant participant) {
        participant.setConversation(this);
        participants.add(participant);
    }

    /** Moves lastMessageAt forward only. */
    public void touch(Instant at) {
        if (lastMessageAt == null || at.isAfter(lastMessageAt)) {
            lastMessageAt = at;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conversation that = (Conversation) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return 31;
    }
}
