package com.realtime.teamhub.typing;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

/**
 * 타이핑 상태 저장소. key = (chat type, reference id, user id), 값은 시작 시각.
 * 만료는 저장소의 TTL 에 맡긴다.
 */
public interface TypingIndicatorStore {

    /** upsert. 같은 키면 시작 시각과 TTL 을 갱신 (last-write-wins) */
    void start(ChatType chatType, UUID referenceId, UUID userId, Duration ttl);

    void stop(ChatType chatType, UUID referenceId, UUID userId);

    /** 아직 만료되지 않은 사용자 */
    Set<UUID> activeTypers(ChatType chatType, UUID referenceId);
}
