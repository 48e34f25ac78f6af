package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.bridge.ScopeBroadcast;
import com.realtime.teamhub.common.AfterCommit;
import com.realtime.teamhub.config.RabbitConfig;
import com.realtime.teamhub.config.RealtimeProperties;
import com.realtime.teamhub.realtime.hub.ConnectionHub;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.protocol.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * 채팅/DM 브로드캐스트의 단일 진입점.
 * cluster-fanout 이 꺼져 있으면 로컬 허브로 바로, 켜져 있으면 브로커 경유로 모든 인스턴스에 전파.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatFanoutService {

    private final ConnectionHub hub;
    private final RabbitTemplate rabbitTemplate;
    private final RealtimeProperties props;

    public void broadcast(ScopeKey scope, Envelope envelope, @Nullable UUID excludeUser, @Nullable UUID senderId) {
        if (!props.isClusterFanout()) {
            hub.broadcast(scope, envelope, excludeUser, senderId);
            return;
        }
        try {
            rabbitTemplate.convertAndSend(RabbitConfig.SCOPE_EXCHANGE, "",
                    ScopeBroadcast.of(scope, envelope, excludeUser, senderId));
        } catch (AmqpException e) {
            // 브로커 장애 시 최소한 이 인스턴스의 연결에는 전달
            log.warn("Scope broadcast publish failed for {} ({}), delivering locally", scope, e.getMessage());
            hub.broadcast(scope, envelope, excludeUser, senderId);
        }
    }

    /** 현재 트랜잭션이 커밋된 뒤 전송. 트랜잭션 밖이면 즉시 */
    public void broadcastAfterCommit(ScopeKey scope, Envelope envelope,
                                     @Nullable UUID excludeUser, @Nullable UUID senderId) {
        AfterCommit.run(() -> broadcast(scope, envelope, excludeUser, senderId));
    }
}
