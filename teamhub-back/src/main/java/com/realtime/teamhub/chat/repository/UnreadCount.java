package com.realtime.teamhub.chat.repository;

import java.time.Instant;
import java.util.UUID;

/** 채팅방(프로젝트 또는 DM 대화)별 안 읽은 메시지 집계 */
public interface UnreadCount {

    UUID getReferenceId();

    Long getUnreadCount();

    Instant getLastMessageAt();
}
