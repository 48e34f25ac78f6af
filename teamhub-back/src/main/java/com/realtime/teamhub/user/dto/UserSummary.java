package com.realtime.teamhub.user.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/** 메시지 응답에 붙는 작성자 표시 정보 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserSummary(UUID id, String displayName, String avatarUrl) {}
