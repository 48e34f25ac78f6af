package com.realtime.teamhub.typing;

import com.realtime.teamhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisTypingIndicatorStoreTest {

    @Mock StringRedisTemplate redis;
    @Mock ValueOperations<String, String> values;
    @Mock Cursor<String> cursor;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private RedisTypingIndicatorStore store;

    private final UUID chatId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setup() {
        store = new RedisTypingIndicatorStore(redis, clock);
    }

    @Test
    void startWritesKeyWithTtl() {
        when(redis.opsForValue()).thenReturn(values);

        store.start(ChatType.PROJECT, chatId, userId, Duration.ofSeconds(5));

        verify(values).set("typing:project:" + chatId + ":" + userId, "2024-05-01T10:00:00Z", Duration.ofSeconds(5));
    }

    @Test
    void stopDeletesKey() {
        store.stop(ChatType.DIRECT, chatId, userId);

        verify(redis).delete("typing:direct:" + chatId + ":" + userId);
    }

    @Test
    void activeTypersScansPrefixParsesKeysAndSkipsGarbage() {
        UUID other = UUID.randomUUID();
        String prefix = "typing:project:" + chatId + ":";
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, true, false);
        when(cursor.next()).thenReturn(prefix + userId, prefix + "junk", prefix + other);

        assertEquals(Set.of(userId, other), store.activeTypers(ChatType.PROJECT, chatId));

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redis).scan(options.capture());
        assertEquals(prefix + "*", options.getValue().getPattern());
        verify(redis, never()).keys(anyString());
        verify(cursor).close();
    }

    @Test
    void noKeysMeansNobodyTyping() {
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(false);

        assertTrue(store.activeTypers(ChatType.DIRECT, chatId).isEmpty());
        verify(cursor).close();
    }
}
