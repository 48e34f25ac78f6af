package com.realtime.teamhub.realtime.hub;

import com.realtime.teamhub.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * ping/pong 기반 liveness. half-open 연결은 write 실패가 늦게 드러나므로
 * 마지막 수신 시각이 timeout 을 넘긴 연결은 직접 닫는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.realtime.heartbeat", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConnectionHeartbeat {

    private static final ByteBuffer PING_PAYLOAD =
            ByteBuffer.wrap("hb".getBytes(StandardCharsets.US_ASCII)).asReadOnlyBuffer();

    private final ConnectionHub hub;
    private final RealtimeProperties props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.realtime.heartbeat.interval:PT25S}")
    public void sweep() {
        Instant deadline = clock.instant().minus(props.getHeartbeat().getTimeout());
        int expired = 0;
        for (Connection c : hub.allConnections()) {
            if (c.getLastSeen().isBefore(deadline)) {
                hub.prune(c, CloseStatus.GOING_AWAY);
                expired++;
                continue;
            }
            hub.sendControl(c, new PingMessage(PING_PAYLOAD.duplicate()));
        }
        if (expired > 0) {
            log.info("Heartbeat closed {} idle connection(s)", expired);
        }
    }
}
