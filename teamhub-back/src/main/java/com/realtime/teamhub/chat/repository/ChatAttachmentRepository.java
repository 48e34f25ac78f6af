package com.realtime.teamhub.chat.repository;

import com.realtime.teamhub.chat.entity.AttachmentScope;
import com.realtime.teamhub.chat.entity.ChatAttachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ChatAttachmentRepository extends JpaRepository<ChatAttachment, UUID> {

    List<ChatAttachment> findByMessageId(UUID messageId);

    /** 아직 연결 안 된 같은 타입 첨부만 메시지에 연결 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update ChatAttachment a set a.messageId = :messageId
        where a.id in :ids and a.messageType = :scope and a.messageId is null
        """)
    int linkUnlinked(@Param("ids") Collection<UUID> ids,
                     @Param("scope") AttachmentScope scope,
                     @Param("messageId") UUID messageId);
}
