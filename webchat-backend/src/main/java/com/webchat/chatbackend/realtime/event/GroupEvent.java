package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.webchat.chatbackend.user.dto.UserSummaryDto;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupEvent(
        GroupEventKind event,
        Long chatId,
        Long userId,
        List<UserSummaryDto> users
) implements RealtimeEvent {

    public static GroupEvent of(GroupEventKind event, Long chatId, Long userId) {
        return new GroupEvent(event, chatId, userId, null);
    }

    public static GroupEvent membersAdded(Long chatId, List<UserSummaryDto> users) {
        return new GroupEvent(GroupEventKind.MEMBER_ADDED, chatId, null, users);
    }

    @Override
    @JsonProperty("type")
    public EventType type() {
        return EventType.GROUP_EVENT;
    }
}
