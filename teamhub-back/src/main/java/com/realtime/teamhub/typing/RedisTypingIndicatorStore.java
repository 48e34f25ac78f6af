package com.realtime.teamhub.typing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisTypingIndicatorStore implements TypingIndicatorStore {

    private static final String KEY_FMT = "typing:%s:%s:%s"; // chatType, referenceId, userId
    private static final long SCAN_COUNT = 100;

    private final StringRedisTemplate redis;
    private final Clock clock;

    static String key(ChatType chatType, UUID referenceId, UUID userId) {
        return String.format(KEY_FMT, chatType.key(), referenceId, userId);
    }

    @Override
    public void start(ChatType chatType, UUID referenceId, UUID userId, Duration ttl) {
        redis.opsForValue().set(key(chatType, referenceId, userId), clock.instant().toString(), ttl);
    }

    @Override
    public void stop(ChatType chatType, UUID referenceId, UUID userId) {
        redis.delete(key(chatType, referenceId, userId));
    }

    /** KEYS 대신 SCAN. 키 공간이 커도 Redis 를 블로킹하지 않음 */
    @Override
    public Set<UUID> activeTypers(ChatType chatType, UUID referenceId) {
        String prefix = String.format("typing:%s:%s:", chatType.key(), referenceId);
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_COUNT).build();
        Set<UUID> out = new HashSet<>();
        try (Cursor<String> keys = redis.scan(options)) {
            while (keys.hasNext()) {
                String k = keys.next();
                try {
                    out.add(UUID.fromString(k.substring(prefix.length())));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring malformed typing key {}", k);
                }
            }
        }
        return out;
    }
}
