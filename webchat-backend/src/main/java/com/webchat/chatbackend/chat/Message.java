package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.user.User;
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
@Table(
        name = "messages",
        indexes = @Index(name = "idx_message_conversation_time", columnList = "conversation_id,createdAt")
)
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    private Conversation conversation;

    // null for system messages
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sender_id")
    private User sender;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 16)
    private MessageType type = MessageType.TEXT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageState state = MessageState.ACTIVE;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    private Instant deletedAt;

    @OneToMany(mappedBy = "message", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Attachment> attachments = new ArrayList<>();

    @OneToMany(mappedBy = "message", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<MessageReaction> reactions = new ArrayList<>();

    public static Message system(Conversation conversation, String text) {
        Message m = new Message();
        m.setConversation(conversation);
        m.setContent(text);
        m.setType(MessageType.SYSTEM);
        return m;
    }

    public Long getSenderId() {
        return sender == null ? null : sender.getId();
    }

    public boolean isTombstoned() {
        return state == MessageState.TOMBSTONED;
    }

    public void addAttachment(Attachment attachment) {
        attachment.setMessage(this);
        attachments.add(attachment);
    }

    /**
     * ACTIVE -> TOMBSTONED. Clears content and attachments, keeps id, sender,
     * conversation and createdAt. Returns false when already tombstoned.
     */
    public boolean tombstone(Instant at) {
        if (state == MessageState.TOMBSTONED) {
            return false;
        }
        state = MessageState.TOMBSTONED;
        deletedAt = at;
        content = null;
        attachments.clear();
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return id != null && id.equals(message.id);
    }

    @Override
    public int hashCode() {
        return 31;
    }
}
