package com.realtime.teamhub.typing;

import com.fasterxml.jackson.annotation.JsonValue;
import com.realtime.teamhub.realtime.hub.ScopeKey;

import java.util.UUID;

public enum ChatType {
    PROJECT, DIRECT;

    public ScopeKey scopeOf(UUID referenceId) {
        return this == PROJECT ? ScopeKey.project(referenceId) : ScopeKey.direct(referenceId);
    }

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
