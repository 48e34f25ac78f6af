package com.realtime.teamhub.inbox.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.teamhub.inbox.entity.InboxEventType;
import com.realtime.teamhub.inbox.entity.InboxItem;

import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InboxItemDto(
        UUID id,
        String title,
        String message,
        Instant messageTime,
        @JsonProperty("is_read") boolean read,
        @JsonProperty("is_archived") boolean archived,
        InboxEventType eventType,
        UUID referenceId,
        UUID userBy
) {
    public static InboxItemDto from(InboxItem i) {
        return new InboxItemDto(i.getId(), i.getTitle(), i.getMessage(), i.getCreatedAt(),
                i.isRead(), i.isArchived(), i.getEventType(), i.getReferenceId(), i.getUserBy());
    }
}
