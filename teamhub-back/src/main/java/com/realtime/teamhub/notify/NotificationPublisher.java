package com.realtime.teamhub.notify;

import com.realtime.teamhub.config.RabbitConfig;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * 알림 이벤트를 fanout exchange 로 발행. 실패는 로그 후 false, 예외를 던지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationPublisher {

    private final RabbitTemplate rabbitTemplate;

    public boolean publish(NotificationEvent event) {
        try {
            rabbitTemplate.convertAndSend(RabbitConfig.NOTIFY_EXCHANGE, "", event);
            log.debug("Notification published: {} -> user={} org={}", event.getType(), event.getUserId(), event.getOrgId());
            return true;
        } catch (AmqpException e) {
            log.warn("Notification publish failed ({} user={}): {}", event.getType(), event.getUserId(), e.getMessage());
            return false;
        }
    }

    public boolean publish(UUID userId, UUID orgId, OutboundEventType type, Map<String, Object> payload) {
        return publish(NotificationEvent.builder()
                .userId(userId)
                .orgId(orgId)
                .type(type.wire())
                .payload(payload)
                .build());
    }
}
