package com.realtime.teamhub.chat.repository;

import com.realtime.teamhub.chat.entity.ProjectMessageRead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ProjectMessageReadRepository extends JpaRepository<ProjectMessageRead, Long> {

    List<ProjectMessageRead> findByMessageIdInOrderByReadAtAscIdAsc(Collection<UUID> messageIds);

    List<ProjectMessageRead> findByMessageIdOrderByReadAtAscIdAsc(UUID messageId);

    /**
     * (message, reader) 행이 이미 있으면 아무것도 하지 않는다. uk_message_reader 충돌은 0 을 반환.
     * 동시에 같은 메시지를 읽음 처리하는 두 트랜잭션이 서로 실패시키지 않도록 INSERT IGNORE 사용.
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
        insert ignore into project_message_reads (message_id, user_id, read_at)
        values (:messageId, :userId, :readAt)
        """, nativeQuery = true)
    int insertIfAbsent(@Param("messageId") UUID messageId,
                       @Param("userId") UUID userId,
                       @Param("readAt") Instant readAt);
}
