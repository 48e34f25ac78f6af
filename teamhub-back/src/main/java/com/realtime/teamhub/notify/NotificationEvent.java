package com.realtime.teamhub.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.Map;
import java.util.UUID;

/**
 * 브리지로 흐르는 일회성 알림 이벤트. 저장하지 않는다 (기록은 인박스 테이블).
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
@ToString
public class NotificationEvent {
    @JsonProperty("user_id")
    private UUID userId;

    @JsonProperty("org_id")
    private UUID orgId;

    // inbox_new / inbox_read / inbox_archived / inbox_deleted / unread_count
    private String type;

    private Map<String, Object> payload;
}
