package com.realtime.teamhub.realtime.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 소켓으로 내려가는 이벤트 한 건. 와이어 형태는 {"type": ..., 나머지 필드...}.
 * 브로드캐스트 시 수신자마다 {@link #personalize(UUID, UUID)} 로 복사본을 만든다.
 */
public final class Envelope {

    private final OutboundEventType type;
    private final Map<String, Object> fields;

    private Envelope(OutboundEventType type, Map<String, Object> fields) {
        this.type = Objects.requireNonNull(type, "type");
        this.fields = fields;
    }

    public static Envelope of(OutboundEventType type) {
        return new Envelope(type, new LinkedHashMap<>());
    }

    /** 브리지로 넘어온 필드 맵 복원용. payload 안의 "type" 은 무시 */
    public static Envelope restore(OutboundEventType type, Map<String, Object> fields) {
        Envelope e = of(type);
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (!"type".equals(k)) e.with(k, v);
            });
        }
        return e;
    }

    public static Envelope error(String message) {
        return of(OutboundEventType.ERROR).with("message", message);
    }

    public Envelope with(String key, Object value) {
        if ("type".equals(key)) {
            throw new IllegalArgumentException("'type' is reserved");
        }
        fields.put(key, value);
        return this;
    }

    public OutboundEventType type() {
        return type;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * 수신자 기준 복사본. 메시지 계열은 is_own_message, 그 외는 is_own 을 붙인다.
     * sender 가 없으면 그대로 반환.
     */
    public Envelope personalize(UUID recipientId, UUID senderId) {
        if (senderId == null) return this;
        Envelope copy = new Envelope(type, new LinkedHashMap<>(fields));
        boolean own = senderId.equals(recipientId);
        copy.with(type.isMessageFamily() ? "is_own_message" : "is_own", own);
        copy.with("sender_id", senderId.toString());
        return copy;
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.wire());
        wire.putAll(fields);
        return wire;
    }

    @Override
    public String toString() {
        return "Envelope" + toWire();
    }
}
