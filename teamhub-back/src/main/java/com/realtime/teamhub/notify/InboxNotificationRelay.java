package com.realtime.teamhub.notify;

import com.realtime.teamhub.realtime.hub.ConnectionHub;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 프로세스당 하나의 구독자. 익명 큐(인스턴스 전용)로 모든 알림을 받아
 * 이 프로세스가 가진 인박스 연결에만 전달한다. 연결이 없으면 아무 일도 하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboxNotificationRelay {

    private final ConnectionHub hub;

    @RabbitListener(queues = "#{notificationRelayQueue.name}")
    public void onEvent(NotificationEvent event) {
        relay(event);
    }

    /** @return 전달된 연결 수 (검증 실패 시 -1) */
    public int relay(NotificationEvent event) {
        if (event == null || event.getUserId() == null || event.getOrgId() == null
                || event.getType() == null || event.getType().isBlank()) {
            log.warn("Notification dropped: missing user_id/org_id/type. payload={}", event);
            return -1;
        }
        Optional<OutboundEventType> type = OutboundEventType.fromWire(event.getType());
        if (type.isEmpty()) {
            log.warn("Notification dropped: unknown type {}", event.getType());
            return -1;
        }
        try {
            int delivered = hub.sendToUser(ScopeKey.inbox(event.getOrgId()), event.getUserId(),
                    Envelope.restore(type.get(), event.getPayload()));
            log.debug("Notification {} -> user={} org={} delivered={}",
                    event.getType(), event.getUserId(), event.getOrgId(), delivered);
            return delivered;
        } catch (Exception e) {
            log.error("Notification relay failed for user={} org={}", event.getUserId(), event.getOrgId(), e);
            return 0;
        }
    }
}
