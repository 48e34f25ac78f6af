package com.realtime.teamhub.realtime.hub;

import java.util.Objects;
import java.util.UUID;

/**
 * (scope type, scope id). INBOX 의 id 는 organization id.
 */
public record ScopeKey(ScopeType type, UUID id) {

    public ScopeKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static ScopeKey project(UUID projectId) {
        return new ScopeKey(ScopeType.PROJECT_CHAT, projectId);
    }

    public static ScopeKey direct(UUID conversationId) {
        return new ScopeKey(ScopeType.DIRECT_MESSAGE, conversationId);
    }

    public static ScopeKey inbox(UUID orgId) {
        return new ScopeKey(ScopeType.INBOX, orgId);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + id;
    }
}
