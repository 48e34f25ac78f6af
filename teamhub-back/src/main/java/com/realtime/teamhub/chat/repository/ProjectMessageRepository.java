package com.realtime.teamhub.chat.repository;

import com.realtime.teamhub.chat.entity.ProjectMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProjectMessageRepository extends JpaRepository<ProjectMessage, UUID> {

    Optional<ProjectMessage> findByIdAndProjectId(UUID id, UUID projectId);

    boolean existsByIdAndProjectId(UUID id, UUID projectId);

    // 최신 N개 (삭제 제외)
    List<ProjectMessage> findByProjectIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID projectId, Pageable pageable);

    // 커서(특정 시각 이전) 기준으로 N개
    List<ProjectMessage> findByProjectIdAndDeletedAtIsNullAndCreatedAtBeforeOrderByCreatedAtDesc(
            UUID projectId, Instant before, Pageable pageable);

    /** cursor 시각 이하, 삭제되지 않았고 아직 user 가 읽지 않은 메시지 id */
    @Query("""
        select m.id from ProjectMessage m
        where m.projectId = :projectId
          and m.deletedAt is null
          and m.createdAt <= :upTo
          and not exists (
              select r.id from ProjectMessageRead r
              where r.messageId = m.id and r.userId = :userId)
        order by m.createdAt asc
        """)
    List<UUID> findUnreadIdsUpTo(@Param("projectId") UUID projectId,
                                 @Param("userId") UUID userId,
                                 @Param("upTo") Instant upTo);

    Optional<ProjectMessage> findFirstByProjectIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID projectId);

    /** 프로젝트별로 다른 사람이 보낸, user 가 아직 안 읽은 메시지 수. 0 인 프로젝트는 결과에 없음 */
    @Query("""
        select m.projectId as referenceId, count(m) as unreadCount, max(m.createdAt) as lastMessageAt
        from ProjectMessage m
        where m.projectId in :projectIds
          and m.userId <> :userId
          and m.deletedAt is null
          and not exists (
              select r.id from ProjectMessageRead r
              where r.messageId = m.id and r.userId = :userId)
        group by m.projectId
        """)
    List<UnreadCount> countUnreadByProject(@Param("projectIds") Collection<UUID> projectIds,
                                           @Param("userId") UUID userId);
}
