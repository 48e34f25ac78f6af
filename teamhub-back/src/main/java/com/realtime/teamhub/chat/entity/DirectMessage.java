package com.realtime.teamhub.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "direct_messages",
        indexes = {
                @Index(name = "ix_direct_messages_conv_created", columnList = "conversation_id, created_at"),
                @Index(name = "ix_direct_messages_receiver_read", columnList = "receiver_id, read_at")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DirectMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "conversation_id", nullable = false)
    private UUID conversationId;

    @Column(name = "sender_id", nullable = false)
    private UUID senderId;

    @Column(name = "receiver_id", nullable = false)
    private UUID receiverId;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(length = 10_000)
    private String body;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "direct_message_attachments", joinColumns = @JoinColumn(name = "message_id"))
    @OrderColumn(name = "attachment_order")
    @Column(name = "attachment_id", nullable = false)
    @Builder.Default
    private List<UUID> attachmentIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 10)
    private MessageType messageType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "edited_at")
    private Instant editedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    // 수신자가 읽은 시각 (null = 안 읽음)
    @Column(name = "read_at")
    private Instant readAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
