package com.webchat.chatbackend.presence;

public enum PresenceTransition {
    /** First handle registered: offline -> online. */
    CAME_ONLINE,
    /** Last handle removed: online -> offline. */
    WENT_OFFLINE,
    /** Handle churn that did not change the user's online status. */
    UNCHANGED
}
