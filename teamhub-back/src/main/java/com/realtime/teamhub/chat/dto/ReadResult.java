package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.UUID;

/**
 * mark-read 결과. messageIds 는 이번 호출로 실제 상태가 바뀐 것만 (재호출 시 빈 리스트).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReadResult(
        UUID lastReadMessageId,
        List<UUID> messageIds
) {
    public boolean changed() {
        return !messageIds.isEmpty();
    }
}
