package com.realtime.teamhub.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "project_messages",
        indexes = {
                @Index(name = "ix_project_messages_project_created", columnList = "project_id, created_at")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProjectMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    // 작성자
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(length = 10_000)
    private String body;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "project_message_attachments", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "attachment_order")
    @Column(name = "attachment_id", nullable = false)
    @Builder.Default
    private List<UUID> attachmentIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 10)
    private MessageType messageType;

    @Column(name = "reply_to_id")
    private UUID replyToId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "edited_at")
    private Instant editedAt;

    // soft delete 표시. 한 번 찍히면 되돌리지 않음
    @Column(name = "deleted_at")
    private Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
