package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.user.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "conversation_participants",
        uniqueConstraints = @UniqueConstraint(name = "uq_participant_conversation_user",
                columnNames = {"conversation_id", "user_id"}),
        indexes = @Index(name = "idx_participant_user", columnList = "user_id")
)
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    private Conversation conversation;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ParticipantRole role = ParticipantRole.MEMBER;

    @Column(nullable = false)
    private Instant joinedAt = Instant.now();

    @Column(nullable = false)
    private Instant lastReadAt = Instant.now();

    public Participant(User user, ParticipantRole role) {
        this.user = user;
        this.role = role;
        Instant now = Instant.now();
        this.joinedAt = now;
        this.lastReadAt = now;
    }

    public Long getUserId() {
        return user == null ? null : user.getId();
    }

    public boolean hasRole(ParticipantRole required) {
        return role == required;
    }

    /** Advances the read cursor; never moves it backwards. Returns true when it moved. */
    public boolean advanceReadCursor(Instant to) {
        if (lastReadAt != null && !to.isAfter(lastReadAt)) {
            return false;
        }
        lastReadAt = to;
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Participant that = (Participant) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return 31;
    }
}
