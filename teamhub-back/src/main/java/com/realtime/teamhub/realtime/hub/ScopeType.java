package com.realtime.teamhub.realtime.hub;

/** 브로드캐스트 묶음 단위. */
public enum ScopeType {
    PROJECT_CHAT,
    DIRECT_MESSAGE,
    INBOX
}
