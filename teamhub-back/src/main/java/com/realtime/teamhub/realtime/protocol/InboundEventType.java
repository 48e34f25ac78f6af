package com.realtime.teamhub.realtime.protocol;

import java.util.Arrays;
import java.util.Optional;

/** 클라이언트 → 서버 이벤트 종류 (chat/DM 소켓). */
public enum InboundEventType {
    MESSAGE("message"),
    TYPING("typing"),
    READ("read");

    private final String wire;

    InboundEventType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<InboundEventType> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.wire.equals(value)).findFirst();
    }
}
