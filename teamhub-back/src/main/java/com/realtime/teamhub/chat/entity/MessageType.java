package com.realtime.teamhub.chat.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/** 첨부가 하나라도 있으면 FILE */
public enum MessageType {
    TEXT, FILE;

    public static MessageType forAttachments(int attachmentCount) {
        return attachmentCount > 0 ? FILE : TEXT;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
