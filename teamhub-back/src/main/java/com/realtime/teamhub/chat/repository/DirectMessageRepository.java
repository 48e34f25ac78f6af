package com.realtime.teamhub.chat.repository;

import com.realtime.teamhub.chat.entity.DirectMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DirectMessageRepository extends JpaRepository<DirectMessage, UUID> {

    Optional<DirectMessage> findByIdAndConversationId(UUID id, UUID conversationId);

    List<DirectMessage> findByConversationIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID conversationId, Pageable pageable);

    List<DirectMessage> findByConversationIdAndDeletedAtIsNullAndCreatedAtBeforeOrderByCreatedAtDesc(
            UUID conversationId, Instant before, Pageable pageable);

    /** 상대가 보낸, 아직 안 읽은 수신 메시지 (cursor 시각 이하) */
    @Query("""
        select m.id from DirectMessage m
        where m.conversationId = :conversationId
          and m.receiverId = :receiverId
          and m.deletedAt is null
          and m.readAt is null
          and m.createdAt <= :upTo
        order by m.createdAt asc
        """)
    List<UUID> findUnreadInboundIdsUpTo(@Param("conversationId") UUID conversationId,
                                        @Param("receiverId") UUID receiverId,
                                        @Param("upTo") Instant upTo);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DirectMessage m set m.readAt = :readAt where m.id in :ids and m.readAt is null")
    int stampReadAt(@Param("ids") Collection<UUID> ids, @Param("readAt") Instant readAt);

    /** 조직 안에서 user 가 받은, 아직 안 읽은 DM 수 (대화별) */
    @Query("""
        select m.conversationId as referenceId, count(m) as unreadCount, max(m.createdAt) as lastMessageAt
        from DirectMessage m
        where m.organizationId = :orgId
          and m.receiverId = :userId
          and m.readAt is null
          and m.deletedAt is null
        group by m.conversationId
        """)
    List<UnreadCount> countUnreadByConversation(@Param("orgId") UUID orgId, @Param("userId") UUID userId);
}
