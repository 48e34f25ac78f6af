package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

/** body 나 attachments 중 하나는 있어야 함 (서비스에서 검증). reply_to_id 는 프로젝트 채팅만 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendMessageRequest(
        @Size(max = 10_000) String body,
        @Size(max = 5) List<UUID> attachments,
        UUID replyToId
) {}
