package com.realtime.teamhub.realtime.hub;

import lombok.Getter;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * 허브에 등록된 라이브 연결 하나. 세션 핸들은 허브가 소유한다.
 */
@Getter
public class Connection {

    private final ScopeKey scope;
    private final UUID userId;
    private final WebSocketSession session;
    private final Instant connectedAt;
    private volatile Instant lastSeen;

    public Connection(ScopeKey scope, UUID userId, WebSocketSession session, Instant connectedAt) {
        this.scope = scope;
        this.userId = userId;
        this.session = session;
        this.connectedAt = connectedAt;
        this.lastSeen = connectedAt;
    }

    public String getId() {
        return session.getId();
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }

    void sendText(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    void sendRaw(WebSocketMessage<?> message) throws IOException {
        session.sendMessage(message);
    }

    @Override
    public String toString() {
        return "Connection[" + getId() + " " + scope + " user=" + userId + "]";
    }
}
