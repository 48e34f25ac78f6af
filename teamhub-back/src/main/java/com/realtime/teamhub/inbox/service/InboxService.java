package com.realtime.teamhub.inbox.service;

import com.realtime.teamhub.common.AfterCommit;
import com.realtime.teamhub.inbox.dto.InboxItemDto;
import com.realtime.teamhub.inbox.dto.InboxPage;
import com.realtime.teamhub.inbox.dto.NewInboxItem;
import com.realtime.teamhub.inbox.entity.InboxItem;
import com.realtime.teamhub.inbox.repository.InboxItemRepository;
import com.realtime.teamhub.notify.NotificationPublisher;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import com.realtime.teamhub.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 인박스 저장 + 변경 후 브리지 이벤트 발행.
 * 발행은 커밋 이후에만, 실패해도 저장 결과에는 영향 없음.
 * inbox_new 는 수신자가 브라우저 알림을 끈 경우 저장만 하고 푸시하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboxService {

    private final InboxItemRepository inboxRepo;
    private final NotificationPublisher publisher;
    private final UserDirectory userDirectory;
    private final Clock clock;

    @Transactional
    public InboxItemDto create(NewInboxItem req) {
        InboxItem item = InboxItem.builder()
                .userId(req.userId())
                .orgId(req.orgId())
                .userBy(req.userBy())
                .title(req.title())
                .message(req.message())
                .eventType(req.eventType())
                .referenceId(req.referenceId())
                .read(false)
                .archived(false)
                .createdAt(clock.instant())
                .build();
        item = inboxRepo.save(item);
        log.info("Inbox item {} created for user={} org={} ({})", item.getId(), item.getUserId(),
                item.getOrgId(), item.getEventType());

        InboxItemDto dto = InboxItemDto.from(item);
        UUID userId = item.getUserId();
        UUID orgId = item.getOrgId();
        if (!userDirectory.browserNotificationsEnabled(userId)) {
            log.debug("Browser notifications off for user={}, inbox_new not pushed", userId);
            return dto;
        }
        AfterCommit.run(() -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("data", dto);
            payload.put("unread_count", unreadCount(userId, orgId));
            publisher.publish(userId, orgId, OutboundEventType.INBOX_NEW, payload);
        });
        return dto;
    }

    @Transactional(readOnly = true)
    public InboxPage list(UUID userId, UUID orgId, boolean archived, boolean unreadOnly, int page, int size) {
        var pageable = PageRequest.of(Math.max(0, page), Math.min(100, Math.max(1, size)),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<InboxItem> result = unreadOnly
                ? inboxRepo.findByUserIdAndOrgIdAndArchivedAndRead(userId, orgId, archived, false, pageable)
                : inboxRepo.findByUserIdAndOrgIdAndArchived(userId, orgId, archived, pageable);
        return new InboxPage(result.map(InboxItemDto::from).getContent(),
                result.getTotalElements(), pageable.getPageNumber(), pageable.getPageSize());
    }

    @Transactional(readOnly = true)
    public long unreadCount(UUID userId, UUID orgId) {
        return inboxRepo.countByUserIdAndOrgIdAndReadFalseAndArchivedFalse(userId, orgId);
    }

    @Transactional
    public InboxItemDto markRead(UUID inboxId, UUID userId) {
        InboxItem item = load(inboxId, userId);
        item.setRead(true);
        announce(item, OutboundEventType.INBOX_READ);
        return InboxItemDto.from(item);
    }

    @Transactional
    public InboxItemDto archive(UUID inboxId, UUID userId) {
        InboxItem item = load(inboxId, userId);
        item.setArchived(true);
        announce(item, OutboundEventType.INBOX_ARCHIVED);
        return InboxItemDto.from(item);
    }

    @Transactional
    public InboxItemDto unarchive(UUID inboxId, UUID userId) {
        InboxItem item = load(inboxId, userId);
        item.setArchived(false);
        // 보관 해제는 별도 이벤트 없이 카운트만 갱신
        UUID uid = item.getUserId();
        UUID orgId = item.getOrgId();
        AfterCommit.run(() -> publishUnreadCount(uid, orgId));
        return InboxItemDto.from(item);
    }

    @Transactional
    public void delete(UUID inboxId, UUID userId) {
        InboxItem item = load(inboxId, userId);
        inboxRepo.delete(item);
        announce(item, OutboundEventType.INBOX_DELETED);
    }

    private InboxItem load(UUID inboxId, UUID userId) {
        return inboxRepo.findByIdAndUserId(inboxId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Inbox item not found"));
    }

    private void announce(InboxItem item, OutboundEventType type) {
        UUID itemId = item.getId();
        UUID userId = item.getUserId();
        UUID orgId = item.getOrgId();
        AfterCommit.run(() -> {
            publisher.publish(userId, orgId, type, Map.of("inbox_id", itemId));
            publishUnreadCount(userId, orgId);
        });
    }

    private void publishUnreadCount(UUID userId, UUID orgId) {
        publisher.publish(userId, orgId, OutboundEventType.UNREAD_COUNT, Map.of("count", unreadCount(userId, orgId)));
    }
}
