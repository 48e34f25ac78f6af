package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.entity.AttachmentScope;
import com.realtime.teamhub.chat.repository.ChatAttachmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 업로드된 첨부를 메시지에 연결. 별도 트랜잭션이라 실패해도
 * 메시지 저장 트랜잭션을 rollback-only 로 만들지 않는다. 호출 측에서 예외를 로그로 처리.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentLinker {

    private final ChatAttachmentRepository attachmentRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int link(List<UUID> attachmentIds, UUID messageId, AttachmentScope scope) {
        if (attachmentIds == null || attachmentIds.isEmpty()) return 0;
        int linked = attachmentRepo.linkUnlinked(attachmentIds, scope, messageId);
        if (linked < attachmentIds.size()) {
            log.warn("Linked {}/{} attachments to {} message {}", linked, attachmentIds.size(), scope, messageId);
        } else {
            log.info("Linked {} attachments to {} message {}", linked, scope, messageId);
        }
        return linked;
    }
}
