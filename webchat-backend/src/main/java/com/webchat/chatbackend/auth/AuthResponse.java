package com.webchat.chatbackend.auth;

import com.webchat.chatbackend.user.dto.UserSummaryDto;

public record AuthResponse(String accessToken, String tokenType, UserSummaryDto user) {
}
