package com.realtime.teamhub.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 전송된 프레임을 기록하는 mock WebSocketSession.
 */
public final class RecordingSessions {

    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private static final AtomicInteger SEQ = new AtomicInteger();

    private RecordingSessions() {}

    public static final class Recorded {
        public final WebSocketSession session;
        public final List<String> frames = new CopyOnWriteArrayList<>();
        public final List<WebSocketMessage<?>> controlFrames = new CopyOnWriteArrayList<>();
        public final AtomicReference<CloseStatus> closedWith = new AtomicReference<>();
        final AtomicBoolean open = new AtomicBoolean(true);

        Recorded(WebSocketSession session) {
            this.session = session;
        }

        public List<Map<String, Object>> decoded() {
            List<Map<String, Object>> out = new ArrayList<>();
            for (String f : frames) {
                try {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> m = MAPPER.readValue(f, Map.class);
                    out.add(m);
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            }
            return out;
        }

        public Map<String, Object> last() {
            List<Map<String, Object>> all = decoded();
            return all.isEmpty() ? null : all.get(all.size() - 1);
        }
    }

    public static Recorded open() {
        return open(URI.create("ws://localhost/ws/test"), new HttpHeaders());
    }

    public static Recorded open(URI uri, HttpHeaders headers) {
        WebSocketSession s = mock(WebSocketSession.class, withSettings().strictness(Strictness.LENIENT));
        Recorded r = new Recorded(s);
        Map<String, Object> attributes = new HashMap<>();
        String id = "s" + SEQ.incrementAndGet();

        when(s.getId()).thenReturn(id);
        when(s.getUri()).thenReturn(uri);
        when(s.getHandshakeHeaders()).thenReturn(headers);
        when(s.getAttributes()).thenReturn(attributes);
        when(s.isOpen()).thenAnswer(inv -> r.open.get());
        try {
            doAnswer(inv -> {
                WebSocketMessage<?> msg = inv.getArgument(0);
                if (msg instanceof TextMessage tm) r.frames.add(tm.getPayload());
                else r.controlFrames.add(msg);
                return null;
            }).when(s).sendMessage(any());
            doAnswer(inv -> {
                r.closedWith.set(inv.getArgument(0));
                r.open.set(false);
                return null;
            }).when(s).close(any(CloseStatus.class));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return r;
    }

    /** sendMessage 가 항상 IOException 을 던지는 세션 (half-open 핸들 흉내) */
    public static Recorded broken() {
        Recorded r = open();
        try {
            doThrow(new IOException("broken pipe")).when(r.session).sendMessage(any());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return r;
    }
}
