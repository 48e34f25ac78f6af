package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.teamhub.chat.entity.MessageType;
import com.realtime.teamhub.user.dto.UserSummary;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProjectMessageDto {
    private UUID id;
    private UUID projectId;
    private UUID userId;
    private String body;
    private List<UUID> attachments;
    private MessageType messageType;
    private UUID replyToId;
    // 읽은 순서대로
    private List<UUID> readBy;
    private Instant createdAt;
    private Instant editedAt;
    private Instant deletedAt;
    private UserSummary user;
}
