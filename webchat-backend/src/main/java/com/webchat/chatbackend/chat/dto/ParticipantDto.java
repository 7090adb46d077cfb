package com.webchat.chatbackend.chat.dto;

import com.webchat.chatbackend.chat.Participant;
import com.webchat.chatbackend.chat.ParticipantRole;
import com.webchat.chatbackend.user.User;

public record ParticipantDto(Long id, String username, String avatarUrl, ParticipantRole role) {

    public static ParticipantDto from(Participant p) {
        User u = p.getUser();
        return new ParticipantDto(u.getId(), u.getUsername(), u.getAvatarUrl(), p.getRole());
    }
}
