package com.realtime.teamhub.inbox.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** 알림의 기록 원본. 실시간 전달은 이 행이 저장된 뒤의 부가 경로 */
@Entity
@Table(
        name = "inbox_items",
        indexes = @Index(name = "ix_inbox_items_user_org", columnList = "user_id, org_id, created_at")
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InboxItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "org_id", nullable = false)
    private UUID orgId;

    // 알림을 발생시킨 사용자
    @Column(name = "user_by")
    private UUID userBy;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(nullable = false, length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 40)
    private InboxEventType eventType;

    @Column(name = "reference_id")
    private UUID referenceId;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
