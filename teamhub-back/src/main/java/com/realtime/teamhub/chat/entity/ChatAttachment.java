package com.realtime.teamhub.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 업로드가 끝난 첨부 메타데이터. 업로드 자체는 별도 파일 서비스가 담당하고
 * 여기서는 메시지 전송 시 message_id 를 연결만 한다.
 */
@Entity
@Table(
        name = "chat_attachments",
        indexes = @Index(name = "ix_chat_attachments_message", columnList = "message_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatAttachment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 10)
    private AttachmentScope messageType;

    // 전송 전에는 null
    @Column(name = "message_id")
    private UUID messageId;

    @Column(nullable = false, length = 512)
    private String storageKey;

    @Column(nullable = false, length = 512)
    private String publicUrl;

    @Column(length = 255)
    private String originalName;

    @Column(length = 100)
    private String contentType;

    @Column(name = "size_bytes")
    private Long size;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
