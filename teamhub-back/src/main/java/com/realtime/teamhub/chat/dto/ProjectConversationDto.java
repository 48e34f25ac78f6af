package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectConversationDto(
        UUID projectId,
        Instant lastMessageAt,
        String lastMessagePreview,
        long unreadCount
) {}
