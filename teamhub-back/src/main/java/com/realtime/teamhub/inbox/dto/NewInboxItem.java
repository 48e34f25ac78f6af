package com.realtime.teamhub.inbox.dto;

import com.realtime.teamhub.inbox.entity.InboxEventType;
import lombok.Builder;

import java.util.UUID;

/** 인박스 항목 생성 요청 (내부 호출용) */
@Builder
public record NewInboxItem(
        UUID userId,
        UUID orgId,
        UUID userBy,
        String title,
        String message,
        InboxEventType eventType,
        UUID referenceId
) {}
