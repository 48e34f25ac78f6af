package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.teamhub.typing.ChatType;

import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnreadCountDto(
        ChatType chatType,
        UUID referenceId,
        long unreadCount,
        Instant lastMessageAt
) {}
