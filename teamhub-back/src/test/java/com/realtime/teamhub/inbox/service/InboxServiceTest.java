package com.realtime.teamhub.inbox.service;

import com.realtime.teamhub.inbox.dto.InboxItemDto;
import com.realtime.teamhub.inbox.dto.NewInboxItem;
import com.realtime.teamhub.inbox.entity.InboxEventType;
import com.realtime.teamhub.inbox.entity.InboxItem;
import com.realtime.teamhub.inbox.repository.InboxItemRepository;
import com.realtime.teamhub.notify.NotificationPublisher;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import com.realtime.teamhub.support.MutableClock;
import com.realtime.teamhub.user.service.UserDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/** 트랜잭션 밖에서 호출하므로 AfterCommit 작업은 즉시 실행된다. */
@ExtendWith(MockitoExtension.class)
class InboxServiceTest {

    @Mock InboxItemRepository inboxRepo;
    @Mock NotificationPublisher publisher;
    @Mock UserDirectory userDirectory;

    private MutableClock clock;
    private InboxService service;

    private final UUID userId = UUID.randomUUID();
    private final UUID orgId = UUID.randomUUID();

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        service = new InboxService(inboxRepo, publisher, userDirectory, clock);
    }

    private InboxItem item() {
        return InboxItem.builder()
                .id(UUID.randomUUID()).userId(userId).orgId(orgId)
                .title("t").message("m").eventType(InboxEventType.TASK_ASSIGNED)
                .createdAt(clock.instant())
                .build();
    }

    @Test
    void createPersistsThenPublishesNewItemWithCount() {
        when(inboxRepo.save(any(InboxItem.class))).thenAnswer(inv -> {
            InboxItem i = inv.getArgument(0);
            i.setId(UUID.randomUUID());
            return i;
        });
        when(inboxRepo.countByUserIdAndOrgIdAndReadFalseAndArchivedFalse(userId, orgId)).thenReturn(3L);
        when(userDirectory.browserNotificationsEnabled(userId)).thenReturn(true);

        InboxItemDto dto = service.create(NewInboxItem.builder()
                .userId(userId).orgId(orgId).title("New message from Bob").message("Bob: hi")
                .eventType(InboxEventType.DIRECT_MESSAGE).build());

        assertFalse(dto.read());
        assertEquals(clock.instant(), dto.messageTime());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(publisher).publish(eq(userId), eq(orgId), eq(OutboundEventType.INBOX_NEW), payload.capture());
        assertSame(dto, payload.getValue().get("data"));
        assertEquals(3L, payload.getValue().get("unread_count"));
    }

    @Test
    void createWithBrowserNotificationsOffStoresButDoesNotPush() {
        when(inboxRepo.save(any(InboxItem.class))).thenAnswer(inv -> {
            InboxItem i = inv.getArgument(0);
            i.setId(UUID.randomUUID());
            return i;
        });
        when(userDirectory.browserNotificationsEnabled(userId)).thenReturn(false);

        InboxItemDto dto = service.create(NewInboxItem.builder()
                .userId(userId).orgId(orgId).title("Task assigned").message("Fix login")
                .eventType(InboxEventType.TASK_ASSIGNED).build());

        assertNotNull(dto.id());
        verify(inboxRepo).save(any(InboxItem.class));
        verifyNoInteractions(publisher);
    }

    @Test
    void markReadAnnouncesThenRefreshesCount() {
        InboxItem i = item();
        when(inboxRepo.findByIdAndUserId(i.getId(), userId)).thenReturn(Optional.of(i));
        when(inboxRepo.countByUserIdAndOrgIdAndReadFalseAndArchivedFalse(userId, orgId)).thenReturn(0L);

        InboxItemDto dto = service.markRead(i.getId(), userId);

        assertTrue(dto.read());
        InOrder order = inOrder(publisher);
        order.verify(publisher).publish(userId, orgId, OutboundEventType.INBOX_READ, Map.of("inbox_id", i.getId()));
        order.verify(publisher).publish(userId, orgId, OutboundEventType.UNREAD_COUNT, Map.of("count", 0L));
    }

    @Test
    void archiveAndDeleteAnnounceTheirEvents() {
        InboxItem i = item();
        when(inboxRepo.findByIdAndUserId(i.getId(), userId)).thenReturn(Optional.of(i));

        assertTrue(service.archive(i.getId(), userId).archived());
        service.delete(i.getId(), userId);

        verify(inboxRepo).delete(i);
        verify(publisher).publish(userId, orgId, OutboundEventType.INBOX_ARCHIVED, Map.of("inbox_id", i.getId()));
        verify(publisher).publish(userId, orgId, OutboundEventType.INBOX_DELETED, Map.of("inbox_id", i.getId()));
        verify(publisher, times(2)).publish(eq(userId), eq(orgId), eq(OutboundEventType.UNREAD_COUNT), anyMap());
    }

    @Test
    void unarchiveOnlyRefreshesCount() {
        InboxItem i = item();
        i.setArchived(true);
        when(inboxRepo.findByIdAndUserId(i.getId(), userId)).thenReturn(Optional.of(i));
        when(inboxRepo.countByUserIdAndOrgIdAndReadFalseAndArchivedFalse(userId, orgId)).thenReturn(1L);

        assertFalse(service.unarchive(i.getId(), userId).archived());

        verify(publisher).publish(userId, orgId, OutboundEventType.UNREAD_COUNT, Map.of("count", 1L));
        verifyNoMoreInteractions(publisher);
    }

    @Test
    void someoneElsesItemIsNotFound() {
        UUID id = UUID.randomUUID();
        UUID stranger = UUID.randomUUID();
        when(inboxRepo.findByIdAndUserId(id, stranger)).thenReturn(Optional.empty());

        ResponseStatusException e = assertThrows(ResponseStatusException.class, () -> service.markRead(id, stranger));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
        assertEquals("Inbox item not found", e.getReason());
        verifyNoInteractions(publisher);
    }

    @Test
    void publishFailureDoesNotFailTheWrite() {
        InboxItem i = item();
        when(inboxRepo.findByIdAndUserId(i.getId(), userId)).thenReturn(Optional.of(i));
        when(publisher.publish(any(), any(), any(), any())).thenReturn(false);

        assertTrue(service.markRead(i.getId(), userId).read());
    }
}
