package com.realtime.teamhub.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** 서버 → 클라이언트 이벤트 종류. */
public enum OutboundEventType {
    MESSAGE("message", true),
    MESSAGE_EDITED("message_edited", true),
    MESSAGE_DELETED("message_deleted", true),
    TYPING("typing", false),
    READ("read", false),
    ERROR("error", false),
    INBOX_NEW("inbox_new", false),
    INBOX_READ("inbox_read", false),
    INBOX_ARCHIVED("inbox_archived", false),
    INBOX_DELETED("inbox_deleted", false),
    UNREAD_COUNT("unread_count", false);

    private final String wire;
    private final boolean messageFamily;

    OutboundEventType(String wire, boolean messageFamily) {
        this.wire = wire;
        this.messageFamily = messageFamily;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** 수신자별 is_own_message 스탬프 대상 여부 */
    public boolean isMessageFamily() {
        return messageFamily;
    }

    public static Optional<OutboundEventType> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.wire.equals(value)).findFirst();
    }
}
