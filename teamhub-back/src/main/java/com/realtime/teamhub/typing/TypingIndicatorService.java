package com.realtime.teamhub.typing;

import com.realtime.teamhub.chat.service.ChatFanoutService;
import com.realtime.teamhub.config.RealtimeProperties;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.UUID;

/**
 * 타이핑 시작/종료. 저장소 오류는 로그만 남기고 브로드캐스트는 그대로 진행한다.
 * 본인에게는 보내지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TypingIndicatorService {

    private final TypingIndicatorStore store;
    private final ChatFanoutService fanout;
    private final RealtimeProperties props;

    public void update(ChatType chatType, UUID referenceId, UUID userId, boolean typing) {
        if (typing) start(chatType, referenceId, userId);
        else stop(chatType, referenceId, userId);
    }

    public void start(ChatType chatType, UUID referenceId, UUID userId) {
        try {
            store.start(chatType, referenceId, userId, props.getTypingTtl());
        } catch (Exception e) {
            log.warn("Typing upsert failed for {} {} user={}: {}", chatType, referenceId, userId, e.getMessage());
        }
        announce(chatType, referenceId, userId, true);
    }

    public void stop(ChatType chatType, UUID referenceId, UUID userId) {
        try {
            store.stop(chatType, referenceId, userId);
        } catch (Exception e) {
            log.warn("Typing delete failed for {} {} user={}: {}", chatType, referenceId, userId, e.getMessage());
        }
        announce(chatType, referenceId, userId, false);
    }

    public Set<UUID> activeTypers(ChatType chatType, UUID referenceId) {
        try {
            return store.activeTypers(chatType, referenceId);
        } catch (Exception e) {
            log.warn("Typing lookup failed for {} {}: {}", chatType, referenceId, e.getMessage());
            return Set.of();
        }
    }

    private void announce(ChatType chatType, UUID referenceId, UUID userId, boolean typing) {
        Envelope env = Envelope.of(OutboundEventType.TYPING)
                .with("user_id", userId)
                .with("is_typing", typing);
        fanout.broadcast(chatType.scopeOf(referenceId), env, userId, null);
    }
}
