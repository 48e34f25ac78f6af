package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.teamhub.user.dto.UserSummary;

import java.time.Instant;
import java.util.UUID;

/** 호출자 기준 DM 대화. otherUser 는 상대방 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConversationDto(
        UUID id,
        UUID organizationId,
        UUID user1Id,
        UUID user2Id,
        UserSummary otherUser,
        Instant lastMessageAt,
        Instant createdAt,
        long unreadCount
) {}
