package com.webchat.chatbackend.user.dto;

import com.webchat.chatbackend.user.User;

/** Public profile of a user, safe to hand to any other participant. */
public record UserSummaryDto(Long id, String username, String avatarUrl) {

    public static UserSummaryDto from(User u) {
        return new UserSummaryDto(u.getId(), u.getUsername(), u.getAvatarUrl());
    }
}
