package com.realtime.teamhub.chat.repository;

import com.realtime.teamhub.chat.entity.ChatConversation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface ChatConversationRepository extends JpaRepository<ChatConversation, UUID> {

    Optional<ChatConversation> findByOrganizationIdAndUser1IdAndUser2Id(UUID organizationId, UUID user1Id, UUID user2Id);

    // 최근 메시지 순
    @Query(value = """
        select c from ChatConversation c
        where c.organizationId = :orgId
          and (c.user1Id = :userId or c.user2Id = :userId)
        order by c.lastMessageAt desc, c.createdAt desc
        """,
        countQuery = """
        select count(c) from ChatConversation c
        where c.organizationId = :orgId
          and (c.user1Id = :userId or c.user2Id = :userId)
        """)
    Page<ChatConversation> findForParticipant(@Param("orgId") UUID orgId,
                                              @Param("userId") UUID userId,
                                              Pageable pageable);
}
