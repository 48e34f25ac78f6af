package com.realtime.teamhub.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** 조직 안의 1:1 대화. 참여자 쌍은 user1Id < user2Id (문자열 비교) 로 정규화해 저장 */
@Entity
@Table(
        name = "chat_conversations",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversation_pair",
                columnNames = {"organization_id", "user1_id", "user2_id"})
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatConversation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "user1_id", nullable = false)
    private UUID user1Id;

    @Column(name = "user2_id", nullable = false)
    private UUID user2Id;

    // 목록 정렬용. 새 메시지가 오면 갱신
    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "created_at")
    private Instant createdAt;

    public boolean hasParticipant(UUID userId) {
        return userId != null && (userId.equals(user1Id) || userId.equals(user2Id));
    }

    /** 상대방 id. 참여자가 아니면 IllegalArgumentException */
    public UUID peerOf(UUID userId) {
        if (userId == null) throw new IllegalArgumentException("userId is null");
        if (userId.equals(user1Id)) return user2Id;
        if (userId.equals(user2Id)) return user1Id;
        throw new IllegalArgumentException("not a participant: " + userId);
    }
}
