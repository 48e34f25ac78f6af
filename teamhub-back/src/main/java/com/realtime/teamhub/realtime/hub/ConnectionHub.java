package com.realtime.teamhub.realtime.hub;

import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.FrameCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 로컬 연결 레지스트리.
 * <p>
 * scope → 연결 집합, user → 연결 집합 두 인덱스를 유지한다. 전송은 fire-and-forget:
 * 실패한 핸들은 로그를 남기고 두 인덱스에서 제거할 뿐 호출자에게 예외를 올리지 않는다.
 * 같은 핸들에 대한 전송 순서는 세션 데코레이터가 직렬화한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHub {

    private final FrameCodec codec;
    private final Clock clock;

    private final Map<ScopeKey, Set<Connection>> byScope = new ConcurrentHashMap<>();
    private final Map<UUID, Set<Connection>> byUser = new ConcurrentHashMap<>();

    public Connection connect(ScopeKey scope, UUID userId, WebSocketSession session) {
        Connection c = new Connection(scope, userId, session, clock.instant());
        byScope.compute(scope, (k, set) -> add(set, c));
        byUser.compute(userId, (k, set) -> add(set, c));
        log.info("WS connected: {} (scope size={})", c, connectionsIn(scope).size());
        return c;
    }

    public void disconnect(Connection c) {
        if (c == null) return;
        boolean removed = remove(byScope, c.getScope(), c);
        remove(byUser, c.getUserId(), c);
        if (removed) {
            log.info("WS disconnected: {}", c);
        }
    }

    public int broadcast(ScopeKey scope, Envelope envelope) {
        return broadcast(scope, envelope, null, null);
    }

    /**
     * scope 에 등록된 모든 라이브 핸들에 전송한다.
     *
     * @param excludeUser 이 사용자의 핸들은 건너뜀 (typing 등)
     * @param senderId    있으면 수신자별로 is_own_message / sender_id 를 붙임
     * @return 전송 성공 건수
     */
    public int broadcast(ScopeKey scope, Envelope envelope,
                         @Nullable UUID excludeUser, @Nullable UUID senderId) {
        Set<Connection> targets = byScope.get(scope);
        if (targets == null || targets.isEmpty()) {
            log.debug("No live connections for {}", scope);
            return 0;
        }

        // 개인화가 없으면 한 번만 직렬화
        String shared = (senderId == null) ? codec.encode(envelope) : null;

        int delivered = 0;
        for (Connection c : List.copyOf(targets)) {
            if (excludeUser != null && excludeUser.equals(c.getUserId())) continue;
            String payload = (shared != null)
                    ? shared
                    : codec.encode(envelope.personalize(c.getUserId(), senderId));
            if (deliver(c, payload)) delivered++;
        }
        return delivered;
    }

    /** user 의 연결 중 해당 scope 에 속한 것만 대상으로 전송 (인박스 릴레이용) */
    public int sendToUser(ScopeKey scope, UUID userId, Envelope envelope) {
        Set<Connection> mine = byUser.get(userId);
        if (mine == null || mine.isEmpty()) return 0;

        String payload = codec.encode(envelope);
        int delivered = 0;
        for (Connection c : List.copyOf(mine)) {
            if (!scope.equals(c.getScope())) continue;
            if (deliver(c, payload)) delivered++;
        }
        return delivered;
    }

    /** 단일 연결 전송. 실패 시 prune 후 false. */
    public boolean send(Connection c, Envelope envelope) {
        return deliver(c, codec.encode(envelope));
    }

    /** ping 등 제어 프레임 전송 (heartbeat) */
    public boolean sendControl(Connection c, WebSocketMessage<?> message) {
        try {
            c.sendRaw(message);
            return true;
        } catch (Exception e) {
            log.warn("Control frame failed on {}: {}", c, e.getMessage());
            prune(c, CloseStatus.SESSION_NOT_RELIABLE);
            return false;
        }
    }

    public void prune(Connection c, CloseStatus status) {
        disconnect(c);
        closeQuietly(c.getSession(), status);
    }

    public List<Connection> connectionsIn(ScopeKey scope) {
        Set<Connection> set = byScope.get(scope);
        return set == null ? List.of() : List.copyOf(set);
    }

    public List<Connection> connectionsOf(UUID userId) {
        Set<Connection> set = byUser.get(userId);
        return set == null ? List.of() : List.copyOf(set);
    }

    public List<Connection> allConnections() {
        List<Connection> out = new ArrayList<>();
        byScope.values().forEach(out::addAll);
        return out;
    }

    public int connectionCount() {
        return byScope.values().stream().mapToInt(Set::size).sum();
    }

    private boolean deliver(Connection c, String payload) {
        if (!c.isOpen()) {
            log.warn("Dropping closed handle {}", c);
            disconnect(c);
            return false;
        }
        try {
            c.sendText(payload);
            return true;
        } catch (Exception e) {
            // 핸들이 iterate 와 send 사이에 죽었을 수 있음: 로그 후 prune, 재시도 없음
            log.warn("Send failed on {}: {}", c, e.getMessage());
            prune(c, CloseStatus.SESSION_NOT_RELIABLE);
            return false;
        }
    }

    private static Set<Connection> add(Set<Connection> set, Connection c) {
        Set<Connection> s = (set != null) ? set : ConcurrentHashMap.newKeySet();
        s.add(c);
        return s;
    }

    private static <K> boolean remove(Map<K, Set<Connection>> index, K key, Connection c) {
        boolean[] removed = {false};
        index.computeIfPresent(key, (k, set) -> {
            removed[0] = set.remove(c);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        if (session == null || !session.isOpen()) return;
        try {
            session.close(status);
        } catch (Exception e) {
            log.debug("close failed for session {}: {}", session.getId(), e.getMessage());
        }
    }
}
