package com.realtime.teamhub.chat.bridge;

import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.hub.ScopeType;
import com.realtime.teamhub.realtime.protocol.Envelope;

import java.util.Map;
import java.util.UUID;

/**
 * 인스턴스 간 채팅 브로드캐스트 메시지. 수신한 인스턴스가 자기 허브에 그대로 재생한다.
 */
public record ScopeBroadcast(
        ScopeType scopeType,
        UUID scopeId,
        String type,
        Map<String, Object> fields,
        UUID excludeUser,
        UUID senderId
) {
    public static ScopeBroadcast of(ScopeKey scope, Envelope envelope, UUID excludeUser, UUID senderId) {
        return new ScopeBroadcast(scope.type(), scope.id(), envelope.type().wire(),
                envelope.fields(), excludeUser, senderId);
    }

    public ScopeKey scope() {
        return new ScopeKey(scopeType, scopeId);
    }
}
