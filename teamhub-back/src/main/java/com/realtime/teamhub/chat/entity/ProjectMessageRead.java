package com.realtime.teamhub.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** 프로젝트 메시지 읽음 표시. (message, reader) 당 한 행 */
@Entity
@Table(
        name = "project_message_reads",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_reader", columnNames = {"message_id", "user_id"}),
        indexes = @Index(name = "ix_project_message_reads_user", columnList = "user_id")
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProjectMessageRead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_id", nullable = false)
    private UUID messageId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "read_at", nullable = false)
    private Instant readAt;
}
