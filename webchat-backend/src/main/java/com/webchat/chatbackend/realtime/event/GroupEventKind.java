package com.webchat.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GroupEventKind {
    /** Sent only to the member who was kicked. */
    USER_KICKED("user_kicked"),
    /** Sent to the remaining members after a kick or leave. */
    MEMBER_REMOVED("member_removed"),
    GROUP_DISSOLVED("group_dissolved"),
    /** Sent only to newly added members. */
    ADDED_TO_GROUP("added_to_group"),
    /** Sent to pre-existing members, carries the new members' profiles. */
    MEMBER_ADDED("member_added");

    private final String wireName;

    GroupEventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
