package com.realtime.teamhub.chat.bridge;

import com.realtime.teamhub.realtime.hub.ConnectionHub;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** 다른 인스턴스에서 발행된 채팅 브로드캐스트를 로컬 허브로 재생 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.realtime", name = "cluster-fanout", havingValue = "true")
public class ScopeBroadcastBridge {

    private final ConnectionHub hub;

    @RabbitListener(queues = "#{scopeBroadcastQueue.name}")
    public void onBroadcast(ScopeBroadcast message) {
        if (message == null || message.scopeType() == null || message.scopeId() == null) {
            log.warn("Scope broadcast dropped: scope missing. payload={}", message);
            return;
        }
        Optional<OutboundEventType> type = OutboundEventType.fromWire(message.type());
        if (type.isEmpty()) {
            log.warn("Scope broadcast dropped: unknown type {}", message.type());
            return;
        }
        try {
            int delivered = hub.broadcast(message.scope(), Envelope.restore(type.get(), message.fields()),
                    message.excludeUser(), message.senderId());
            log.debug("Scope broadcast {} -> {} delivered={}", message.type(), message.scope(), delivered);
        } catch (Exception e) {
            log.error("Scope broadcast replay failed for {}", message.scope(), e);
        }
    }
}
