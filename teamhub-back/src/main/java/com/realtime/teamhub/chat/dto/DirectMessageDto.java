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
public class DirectMessageDto {
    private UUID id;
    private UUID conversationId;
    private UUID senderId;
    private UUID receiverId;
    private UUID organizationId;
    private String body;
    private List<UUID> attachments;
    private MessageType messageType;
    private Instant createdAt;
    private Instant editedAt;
    private Instant deletedAt;
    private Instant readAt;
    private UserSummary sender;
    private UserSummary receiver;
}
