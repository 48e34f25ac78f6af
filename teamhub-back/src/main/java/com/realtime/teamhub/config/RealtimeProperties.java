package com.realtime.teamhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "app.realtime")
@Data
public class RealtimeProperties {
    private Duration editWindow = Duration.ofHours(24);
    private int maxAttachments = 5;
    private int maxBodyLength = 10_000;
    private Duration typingTtl = Duration.ofSeconds(5);

    /** true 면 채팅/DM 브로드캐스트를 브로커 경유로 모든 인스턴스에 전파 */
    private boolean clusterFanout = false;

    // ConcurrentWebSocketSessionDecorator 한도
    private int sendTimeLimitMs = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;

    private Heartbeat heartbeat = new Heartbeat();

    @Data
    public static class Heartbeat {
        private boolean enabled = true;
        // 주기는 @Scheduled 가 app.realtime.heartbeat.interval 을 직접 읽음 (ISO-8601)
        private Duration timeout = Duration.ofSeconds(60);
    }
}
