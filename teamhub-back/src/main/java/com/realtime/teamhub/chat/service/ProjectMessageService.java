package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.dto.ProjectMessageDto;
import com.realtime.teamhub.chat.dto.ReadResult;
import com.realtime.teamhub.chat.entity.AttachmentScope;
import com.realtime.teamhub.chat.entity.MessageType;
import com.realtime.teamhub.chat.entity.ProjectMessage;
import com.realtime.teamhub.chat.entity.ProjectMessageRead;
import com.realtime.teamhub.chat.repository.ProjectMessageReadRepository;
import com.realtime.teamhub.chat.repository.ProjectMessageRepository;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import com.realtime.teamhub.user.dto.UserSummary;
import com.realtime.teamhub.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 프로젝트 채팅 메시지 수명주기: send / edit / delete / mark-read.
 * 저장이 성공한 뒤에만 스코프로 브로드캐스트한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectMessageService {

    private final ProjectMessageRepository messageRepo;
    private final ProjectMessageReadRepository readRepo;
    private final AttachmentLinker attachmentLinker;
    private final MessagePolicy policy;
    private final MembershipVerifier membership;
    private final UserDirectory userDirectory;
    private final ChatFanoutService fanout;

    @Transactional
    public ProjectMessageDto send(UUID projectId, UUID userId, @Nullable String body,
                                  @Nullable List<UUID> attachments, @Nullable UUID replyToId) {
        List<UUID> attachmentIds = attachments == null ? List.of() : List.copyOf(attachments);
        policy.validateContent(body, attachmentIds);

        if (replyToId != null && !messageRepo.existsByIdAndProjectId(replyToId, projectId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Reply target not found in this project");
        }

        ProjectMessage m = ProjectMessage.builder()
                .projectId(projectId)
                .userId(userId)
                .body(body)
                .attachmentIds(new ArrayList<>(attachmentIds))
                .messageType(MessageType.forAttachments(attachmentIds.size()))
                .replyToId(replyToId)
                .createdAt(policy.now())
                .build();
        m = messageRepo.save(m);

        if (!attachmentIds.isEmpty()) {
            try {
                attachmentLinker.link(attachmentIds, m.getId(), AttachmentScope.PROJECT);
            } catch (Exception e) {
                log.warn("Failed to link attachments to message {}: {}", m.getId(), e.getMessage());
            }
        }

        ProjectMessageDto dto = toDto(m, List.of(), userDirectory.summaryOf(userId));
        fanout.broadcastAfterCommit(ScopeKey.project(projectId),
                Envelope.of(OutboundEventType.MESSAGE).with("data", dto), null, userId);
        return dto;
    }

    @Transactional
    public ProjectMessageDto edit(UUID projectId, UUID messageId, UUID userId, String newBody) {
        ProjectMessage m = loadActive(projectId, messageId);
        policy.checkEditable(m.getUserId(), userId, m.getCreatedAt());
        policy.validateEditBody(newBody);

        m.setBody(newBody);
        m.setEditedAt(policy.now());

        ProjectMessageDto dto = toDto(m, readersOf(m.getId()), userDirectory.summaryOf(m.getUserId()));
        fanout.broadcastAfterCommit(ScopeKey.project(projectId),
                Envelope.of(OutboundEventType.MESSAGE_EDITED).with("data", dto), null, userId);
        return dto;
    }

    /** 작성자 또는 프로젝트 관리자만. 이미 삭제된 메시지는 404 */
    @Transactional
    public void delete(UUID projectId, UUID messageId, UUID userId) {
        ProjectMessage m = loadActive(projectId, messageId);
        if (!m.getUserId().equals(userId) && !membership.isProjectAdmin(userId, projectId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You can only delete your own messages");
        }
        m.setDeletedAt(policy.now());

        fanout.broadcastAfterCommit(ScopeKey.project(projectId),
                Envelope.of(OutboundEventType.MESSAGE_DELETED).with("message_id", messageId), null, userId);
    }

    /**
     * cursor 이하의 삭제되지 않은 메시지 중 아직 안 읽은 것만 읽음 처리.
     * 이 호출이 실제로 기록한 행만 결과와 read 이벤트에 담는다. 동시 호출이 먼저 쓴 행은 건너뜀.
     * read 이벤트는 읽은 본인의 다른 탭을 제외하고 나머지 멤버에게만 간다.
     */
    @Transactional
    public ReadResult markRead(UUID projectId, UUID userId, UUID lastReadMessageId) {
        ProjectMessage cursor = messageRepo.findByIdAndProjectId(lastReadMessageId, projectId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));

        List<UUID> unread = messageRepo.findUnreadIdsUpTo(projectId, userId, cursor.getCreatedAt());
        if (unread.isEmpty()) {
            return new ReadResult(lastReadMessageId, List.of());
        }

        Instant now = policy.now();
        List<UUID> written = new ArrayList<>(unread.size());
        for (UUID id : unread) {
            if (readRepo.insertIfAbsent(id, userId, now) > 0) {
                written.add(id);
            }
        }
        if (written.isEmpty()) {
            log.debug("Messages up to {} already marked read by {} concurrently", lastReadMessageId, userId);
            return new ReadResult(lastReadMessageId, List.of());
        }

        Envelope env = Envelope.of(OutboundEventType.READ)
                .with("user_id", userId)
                .with("message_id", lastReadMessageId)
                .with("message_ids", written);
        fanout.broadcastAfterCommit(ScopeKey.project(projectId), env, userId, null);
        return new ReadResult(lastReadMessageId, List.copyOf(written));
    }

    /** 삭제된 메시지는 본문/첨부를 숨긴 tombstone 으로 */
    @Transactional(readOnly = true)
    public ProjectMessageDto findById(UUID projectId, UUID messageId) {
        ProjectMessage m = messageRepo.findByIdAndProjectId(messageId, projectId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));
        return toDto(m, readersOf(m.getId()), userDirectory.summaryOf(m.getUserId()));
    }

    /** 최신순, before 커서 이전 limit 건 (1~200). 삭제 메시지 제외 */
    @Transactional(readOnly = true)
    public List<ProjectMessageDto> history(UUID projectId, int limit, @Nullable Instant before) {
        var page = PageRequest.of(0, Math.min(200, Math.max(1, limit)));
        List<ProjectMessage> rows = (before == null)
                ? messageRepo.findByProjectIdAndDeletedAtIsNullOrderByCreatedAtDesc(projectId, page)
                : messageRepo.findByProjectIdAndDeletedAtIsNullAndCreatedAtBeforeOrderByCreatedAtDesc(projectId, before, page);
        if (rows.isEmpty()) return List.of();

        List<UUID> ids = rows.stream().map(ProjectMessage::getId).toList();
        Map<UUID, List<UUID>> readers = readRepo.findByMessageIdInOrderByReadAtAscIdAsc(ids).stream()
                .collect(Collectors.groupingBy(ProjectMessageRead::getMessageId, LinkedHashMap::new,
                        Collectors.mapping(ProjectMessageRead::getUserId, Collectors.toList())));
        Map<UUID, UserSummary> authors = userDirectory.summariesOf(
                rows.stream().map(ProjectMessage::getUserId).collect(Collectors.toSet()));

        return rows.stream()
                .map(m -> toDto(m, readers.getOrDefault(m.getId(), List.of()), authors.get(m.getUserId())))
                .toList();
    }

    private ProjectMessage loadActive(UUID projectId, UUID messageId) {
        return messageRepo.findByIdAndProjectId(messageId, projectId)
                .filter(m -> !m.isDeleted())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));
    }

    private List<UUID> readersOf(UUID messageId) {
        return readRepo.findByMessageIdOrderByReadAtAscIdAsc(messageId).stream()
                .map(ProjectMessageRead::getUserId)
                .toList();
    }

    static ProjectMessageDto toDto(ProjectMessage m, List<UUID> readBy, UserSummary author) {
        boolean deleted = m.isDeleted();
        return ProjectMessageDto.builder()
                .id(m.getId())
                .projectId(m.getProjectId())
                .userId(m.getUserId())
                .body(deleted ? null : m.getBody())
                .attachments(deleted ? List.of() : List.copyOf(m.getAttachmentIds()))
                .messageType(m.getMessageType())
                .replyToId(m.getReplyToId())
                .readBy(readBy)
                .createdAt(m.getCreatedAt())
                .editedAt(m.getEditedAt())
                .deletedAt(m.getDeletedAt())
                .user(author)
                .build();
    }
}
