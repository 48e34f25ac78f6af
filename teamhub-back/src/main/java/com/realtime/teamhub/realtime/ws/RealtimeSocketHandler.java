package com.realtime.teamhub.realtime.ws;

import com.realtime.teamhub.config.RealtimeProperties;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import com.realtime.teamhub.realtime.hub.Connection;
import com.realtime.teamhub.realtime.hub.ConnectionHub;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.hub.ScopeType;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.FrameCodec;
import com.realtime.teamhub.realtime.protocol.FrameDecodingException;
import com.realtime.teamhub.realtime.protocol.InboundFrame;
import com.realtime.teamhub.security.Identity;
import com.realtime.teamhub.security.IdentityVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * /ws/project/{projectId}, /ws/dm/{conversationId}, /ws/inbox/{orgId} 공용 핸들러.
 * <p>
 * 1) 토큰 확인 (query ?token= 또는 Authorization: Bearer) → 실패 시 error 프레임 + 4001<br>
 * 2) 스코프 멤버십 확인 → 실패 시 error 프레임 + 4003<br>
 * 3) 허브 등록 후 프레임 단위 처리. 잘못된 프레임은 error 프레임만 보내고 연결은 유지
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeSocketHandler extends TextWebSocketHandler {

    public static final int CLOSE_UNAUTHENTICATED = 4001;
    public static final int CLOSE_FORBIDDEN = 4003;

    static final String ATTR_CONNECTION = "teamhub.connection";
    private static final String BEARER = "Bearer ";

    private final IdentityVerifier identityVerifier;
    private final MembershipVerifier membership;
    private final ConnectionHub hub;
    private final FrameCodec codec;
    private final ChatFrameDispatcher dispatcher;
    private final RealtimeProperties props;
    private final Clock clock;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String token = extractToken(session);
        if (token == null) {
            reject(session, "Token required", CLOSE_UNAUTHENTICATED);
            return;
        }
        Optional<Identity> identity = identityVerifier.verify(token);
        if (identity.isEmpty()) {
            reject(session, "Invalid token", CLOSE_UNAUTHENTICATED);
            return;
        }
        UUID userId = identity.get().userId();

        ScopeKey scope = resolveScope(session.getUri());
        if (scope == null || !isAllowed(userId, scope)) {
            reject(session, "Access denied", CLOSE_FORBIDDEN);
            return;
        }

        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(
                session, props.getSendTimeLimitMs(), props.getSendBufferSizeLimit());
        Connection c = hub.connect(scope, userId, safe);
        session.getAttributes().put(ATTR_CONNECTION, c);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection c = connectionOf(session);
        if (c == null) return;
        c.touch(clock.instant());

        // 인박스는 서버 → 클라이언트 전용
        if (c.getScope().type() == ScopeType.INBOX) {
            log.debug("Ignoring inbound frame on inbox socket {}", c);
            return;
        }

        InboundFrame frame;
        try {
            frame = codec.decode(message.getPayload());
        } catch (FrameDecodingException e) {
            hub.send(c, Envelope.error(e.getMessage()));
            return;
        }

        try {
            dispatcher.dispatch(c, frame);
        } catch (ResponseStatusException e) {
            hub.send(c, Envelope.error(e.getReason() != null ? e.getReason() : e.getStatusCode().toString()));
        } catch (Exception e) {
            log.error("Frame handling failed on {}", c, e);
            hub.send(c, Envelope.error("Failed to process " + frame.type().wire()));
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        Connection c = connectionOf(session);
        if (c != null) c.touch(clock.instant());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        Connection c = connectionOf(session);
        log.debug("Transport error on {}: {}", c != null ? c : session.getId(), exception.getMessage());
        if (c != null) hub.prune(c, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.disconnect(connectionOf(session));
    }

    private Connection connectionOf(WebSocketSession session) {
        Object c = session.getAttributes().get(ATTR_CONNECTION);
        return (c instanceof Connection conn) ? conn : null;
    }

    private boolean isAllowed(UUID userId, ScopeKey scope) {
        try {
            return switch (scope.type()) {
                case PROJECT_CHAT -> membership.isProjectMember(userId, scope.id());
                case DIRECT_MESSAGE -> membership.isConversationParticipant(userId, scope.id());
                case INBOX -> membership.isOrganizationMember(userId, scope.id());
            };
        } catch (Exception e) {
            log.error("Membership check failed for user={} {}", userId, scope, e);
            return false;
        }
    }

    private void reject(WebSocketSession session, String reason, int code) {
        try {
            session.sendMessage(new TextMessage(codec.encode(Envelope.error(reason))));
        } catch (Exception e) {
            log.debug("error frame not delivered to {}: {}", session.getId(), e.getMessage());
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (Exception e) {
            log.debug("close failed for {}: {}", session.getId(), e.getMessage());
        }
        log.info("WS rejected ({} {}): {}", code, reason, session.getUri());
    }

    static String extractToken(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri != null) {
            String q = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
            if (q != null && !q.isBlank()) return q.trim();
        }
        HttpHeaders headers = session.getHandshakeHeaders();
        String h = headers == null ? null : headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (h != null && h.startsWith(BEARER) && h.length() > BEARER.length()) {
            return h.substring(BEARER.length()).trim();
        }
        return null;
    }

    /** /ws/{kind}/{uuid} → ScopeKey. 형식이 틀리면 null */
    static ScopeKey resolveScope(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        String[] parts = uri.getPath().split("/");
        if (parts.length < 2) return null;
        String kind = parts[parts.length - 2];
        UUID id;
        try {
            id = UUID.fromString(parts[parts.length - 1]);
        } catch (IllegalArgumentException e) {
            return null;
        }
        return switch (kind) {
            case "project" -> ScopeKey.project(id);
            case "dm" -> ScopeKey.direct(id);
            case "inbox" -> ScopeKey.inbox(id);
            default -> null;
        };
    }
}
