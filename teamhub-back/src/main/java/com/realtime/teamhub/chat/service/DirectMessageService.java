package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.dto.DirectMessageDto;
import com.realtime.teamhub.chat.dto.ReadResult;
import com.realtime.teamhub.chat.entity.AttachmentScope;
import com.realtime.teamhub.chat.entity.ChatConversation;
import com.realtime.teamhub.chat.entity.DirectMessage;
import com.realtime.teamhub.chat.entity.MessageType;
import com.realtime.teamhub.chat.repository.ChatConversationRepository;
import com.realtime.teamhub.chat.repository.DirectMessageRepository;
import com.realtime.teamhub.inbox.service.NotificationService;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 1:1 DM 메시지 수명주기. 읽음 상태는 수신 메시지의 read_at 하나.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectMessageService {

    private static final int PREVIEW_LENGTH = 100;

    private final DirectMessageRepository messageRepo;
    private final ChatConversationRepository conversationRepo;
    private final AttachmentLinker attachmentLinker;
    private final MessagePolicy policy;
    private final UserDirectory userDirectory;
    private final ChatFanoutService fanout;
    private final NotificationService notificationService;

    @Transactional
    public DirectMessageDto send(UUID conversationId, UUID senderId, @Nullable String body,
                                 @Nullable List<UUID> attachments) {
        List<UUID> attachmentIds = attachments == null ? List.of() : List.copyOf(attachments);
        policy.validateContent(body, attachmentIds);

        ChatConversation conv = loadConversation(conversationId, senderId);
        UUID receiverId = conv.peerOf(senderId);

        DirectMessage m = DirectMessage.builder()
                .conversationId(conversationId)
                .senderId(senderId)
                .receiverId(receiverId)
                .organizationId(conv.getOrganizationId())
                .body(body)
                .attachmentIds(new ArrayList<>(attachmentIds))
                .messageType(MessageType.forAttachments(attachmentIds.size()))
                .createdAt(policy.now())
                .build();
        m = messageRepo.save(m);
        conv.setLastMessageAt(m.getCreatedAt());

        if (!attachmentIds.isEmpty()) {
            try {
                attachmentLinker.link(attachmentIds, m.getId(), AttachmentScope.DIRECT);
            } catch (Exception e) {
                log.warn("Failed to link attachments to direct message {}: {}", m.getId(), e.getMessage());
            }
        }

        UserSummary sender = userDirectory.summaryOf(senderId);
        DirectMessageDto dto = toDto(m, sender, userDirectory.summaryOf(receiverId));
        fanout.broadcastAfterCommit(ScopeKey.direct(conversationId),
                Envelope.of(OutboundEventType.MESSAGE).with("data", dto), null, senderId);

        // 인박스 알림은 백그라운드. 실패해도 전송 결과에는 영향 없음
        try {
            notificationService.notifyDirectMessage(receiverId, conv.getOrganizationId(), senderId,
                    sender.displayName(), preview(body), conversationId);
        } catch (Exception e) {
            log.error("Failed to schedule DM inbox notification for {}", receiverId, e);
        }
        return dto;
    }

    @Transactional
    public DirectMessageDto edit(UUID conversationId, UUID messageId, UUID userId, String newBody) {
        DirectMessage m = loadActive(conversationId, messageId);
        policy.checkEditable(m.getSenderId(), userId, m.getCreatedAt());
        policy.validateEditBody(newBody);

        m.setBody(newBody);
        m.setEditedAt(policy.now());

        DirectMessageDto dto = toDto(m, userDirectory.summaryOf(m.getSenderId()), userDirectory.summaryOf(m.getReceiverId()));
        fanout.broadcastAfterCommit(ScopeKey.direct(conversationId),
                Envelope.of(OutboundEventType.MESSAGE_EDITED).with("data", dto), null, userId);
        return dto;
    }

    /** DM 에는 관리자 개념이 없으므로 보낸 사람만 삭제 가능 */
    @Transactional
    public void delete(UUID conversationId, UUID messageId, UUID userId) {
        DirectMessage m = loadActive(conversationId, messageId);
        if (!m.getSenderId().equals(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You can only delete your own messages");
        }
        m.setDeletedAt(policy.now());

        fanout.broadcastAfterCommit(ScopeKey.direct(conversationId),
                Envelope.of(OutboundEventType.MESSAGE_DELETED).with("message_id", messageId), null, userId);
    }

    /**
     * 상대가 보낸 메시지 중 cursor 이하, 아직 read_at 이 없는 것만.
     * read_at 은 행 단위 조건부 update 라 동시 호출 중 한쪽만 1 을 받는다. 실제로 찍은 게 없으면 이벤트도 없음.
     */
    @Transactional
    public ReadResult markRead(UUID conversationId, UUID userId, UUID lastReadMessageId) {
        DirectMessage cursor = messageRepo.findByIdAndConversationId(lastReadMessageId, conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));

        List<UUID> unread = messageRepo.findUnreadInboundIdsUpTo(conversationId, userId, cursor.getCreatedAt());
        if (unread.isEmpty()) {
            return new ReadResult(lastReadMessageId, List.of());
        }

        Instant now = policy.now();
        List<UUID> stamped = new ArrayList<>(unread.size());
        for (UUID id : unread) {
            if (messageRepo.stampReadAt(List.of(id), now) > 0) {
                stamped.add(id);
            }
        }
        if (stamped.isEmpty()) {
            log.debug("Direct messages up to {} already read by {} concurrently", lastReadMessageId, userId);
            return new ReadResult(lastReadMessageId, List.of());
        }

        Envelope env = Envelope.of(OutboundEventType.READ)
                .with("user_id", userId)
                .with("message_id", lastReadMessageId)
                .with("message_ids", stamped);
        fanout.broadcastAfterCommit(ScopeKey.direct(conversationId), env, userId, null);
        return new ReadResult(lastReadMessageId, List.copyOf(stamped));
    }

    @Transactional(readOnly = true)
    public DirectMessageDto findById(UUID conversationId, UUID messageId) {
        DirectMessage m = messageRepo.findByIdAndConversationId(messageId, conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));
        return toDto(m, userDirectory.summaryOf(m.getSenderId()), userDirectory.summaryOf(m.getReceiverId()));
    }

    @Transactional(readOnly = true)
    public List<DirectMessageDto> history(UUID conversationId, int limit, @Nullable Instant before) {
        var page = PageRequest.of(0, Math.min(200, Math.max(1, limit)));
        List<DirectMessage> rows = (before == null)
                ? messageRepo.findByConversationIdAndDeletedAtIsNullOrderByCreatedAtDesc(conversationId, page)
                : messageRepo.findByConversationIdAndDeletedAtIsNullAndCreatedAtBeforeOrderByCreatedAtDesc(conversationId, before, page);
        if (rows.isEmpty()) return List.of();

        Map<UUID, UserSummary> users = userDirectory.summariesOf(rows.stream()
                .flatMap(m -> Stream.of(m.getSenderId(), m.getReceiverId()))
                .collect(Collectors.toSet()));
        return rows.stream()
                .map(m -> toDto(m, users.get(m.getSenderId()), users.get(m.getReceiverId())))
                .toList();
    }

    private ChatConversation loadConversation(UUID conversationId, UUID userId) {
        ChatConversation conv = conversationRepo.findById(conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
        if (!conv.hasParticipant(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a participant of this conversation");
        }
        return conv;
    }

    private DirectMessage loadActive(UUID conversationId, UUID messageId) {
        return messageRepo.findByIdAndConversationId(messageId, conversationId)
                .filter(m -> !m.isDeleted())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found"));
    }

    private static String preview(String body) {
        if (body == null || body.isBlank()) return "Sent an attachment";
        return body.length() <= PREVIEW_LENGTH ? body : body.substring(0, PREVIEW_LENGTH);
    }

    static DirectMessageDto toDto(DirectMessage m, UserSummary sender, UserSummary receiver) {
        boolean deleted = m.isDeleted();
        return DirectMessageDto.builder()
                .id(m.getId())
                .conversationId(m.getConversationId())
                .senderId(m.getSenderId())
                .receiverId(m.getReceiverId())
                .organizationId(m.getOrganizationId())
                .body(deleted ? null : m.getBody())
                .attachments(deleted ? List.of() : List.copyOf(m.getAttachmentIds()))
                .messageType(m.getMessageType())
                .createdAt(m.getCreatedAt())
                .editedAt(m.getEditedAt())
                .deletedAt(m.getDeletedAt())
                .readAt(m.getReadAt())
                .sender(sender)
                .receiver(receiver)
                .build();
    }
}
