package com.realtime.teamhub.inbox.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InboxEventType {
    ORGANIZATION_INVITATION,
    PROJECT_MEMBER_ADDED,
    TASK_ASSIGNED,
    TASK_UNASSIGNED,
    TASK_COMPLETED,
    DIRECT_MESSAGE;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
