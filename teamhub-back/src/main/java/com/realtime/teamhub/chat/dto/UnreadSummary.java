package com.realtime.teamhub.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** 조직 내 채팅 전체의 안 읽은 수. 0 인 채팅방은 빠진다 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnreadSummary(
        long totalUnread,
        List<UnreadCountDto> projectChats,
        List<UnreadCountDto> directMessages
) {}
