package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.dto.ProjectMessageDto;
import com.realtime.teamhub.chat.dto.ReadResult;
import com.realtime.teamhub.chat.entity.AttachmentScope;
import com.realtime.teamhub.chat.entity.MessageType;
import com.realtime.teamhub.chat.entity.ProjectMessage;
import com.realtime.teamhub.chat.entity.ProjectMessageRead;
import com.realtime.teamhub.chat.repository.ProjectMessageReadRepository;
import com.realtime.teamhub.chat.repository.ProjectMessageRepository;
import com.realtime.teamhub.config.RealtimeProperties;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import com.realtime.teamhub.support.MutableClock;
import com.realtime.teamhub.user.dto.UserSummary;
import com.realtime.teamhub.user.service.UserDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectMessageServiceTest {

    @Mock ProjectMessageRepository messageRepo;
    @Mock ProjectMessageReadRepository readRepo;
    @Mock AttachmentLinker attachmentLinker;
    @Mock MembershipVerifier membership;
    @Mock UserDirectory userDirectory;
    @Mock ChatFanoutService fanout;

    private MutableClock clock;
    private ProjectMessageService service;

    private final UUID projectId = UUID.randomUUID();
    private final UUID author = UUID.randomUUID();
    private final UUID other = UUID.randomUUID();

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        MessagePolicy policy = new MessagePolicy(new RealtimeProperties(), clock);
        service = new ProjectMessageService(messageRepo, readRepo, attachmentLinker, policy,
                membership, userDirectory, fanout);
    }

    private ProjectMessage existing(UUID userId, Instant createdAt) {
        return ProjectMessage.builder()
                .id(UUID.randomUUID())
                .projectId(projectId)
                .userId(userId)
                .body("original")
                .messageType(MessageType.TEXT)
                .createdAt(createdAt)
                .build();
    }

    private Envelope capturedBroadcast(UUID senderId) {
        ArgumentCaptor<Envelope> env = ArgumentCaptor.forClass(Envelope.class);
        verify(fanout).broadcastAfterCommit(eq(ScopeKey.project(projectId)), env.capture(), isNull(), eq(senderId));
        return env.getValue();
    }

    @Test
    void sendPersistsLinksAndBroadcasts() {
        UUID att = UUID.randomUUID();
        when(messageRepo.save(any(ProjectMessage.class))).thenAnswer(inv -> {
            ProjectMessage m = inv.getArgument(0);
            m.setId(UUID.randomUUID());
            return m;
        });
        when(userDirectory.summaryOf(author)).thenReturn(new UserSummary(author, "Alice", null));

        ProjectMessageDto dto = service.send(projectId, author, "", List.of(att), null);

        assertEquals(MessageType.FILE, dto.getMessageType());
        assertEquals(List.of(att), dto.getAttachments());
        assertEquals(clock.instant(), dto.getCreatedAt());
        assertEquals("Alice", dto.getUser().displayName());
        verify(attachmentLinker).link(List.of(att), dto.getId(), AttachmentScope.PROJECT);

        Envelope env = capturedBroadcast(author);
        assertEquals(OutboundEventType.MESSAGE, env.type());
        assertSame(dto, env.get("data"));
    }

    @Test
    void attachmentLinkFailureDoesNotFailSend() {
        when(messageRepo.save(any(ProjectMessage.class))).thenAnswer(inv -> {
            ProjectMessage m = inv.getArgument(0);
            m.setId(UUID.randomUUID());
            return m;
        });
        doThrow(new IllegalStateException("storage down")).when(attachmentLinker).link(any(), any(), any());

        ProjectMessageDto dto = service.send(projectId, author, "see file", List.of(UUID.randomUUID()), null);

        assertNotNull(dto.getId());
        capturedBroadcast(author);
    }

    @Test
    void emptyMessageIsRejected() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.send(projectId, author, "   ", List.of(), null));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertEquals("Message must have either body text or attachments", e.getReason());
        verifyNoInteractions(messageRepo, fanout);
    }

    @Test
    void tooManyAttachmentsIsRejected() {
        List<UUID> six = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.send(projectId, author, "x", six, null));
        assertEquals("Too many attachments (max 5)", e.getReason());
    }

    @Test
    void replyToMessageOfAnotherProjectIsRejected() {
        UUID reply = UUID.randomUUID();
        when(messageRepo.existsByIdAndProjectId(reply, projectId)).thenReturn(false);

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.send(projectId, author, "re", null, reply));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        verify(messageRepo, never()).save(any());
    }

    @Test
    void editByNonAuthorIsForbidden() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.edit(projectId, m.getId(), other, "hijack"));

        assertEquals(HttpStatus.FORBIDDEN, e.getStatusCode());
        assertEquals("You can only edit your own messages", e.getReason());
        assertEquals("original", m.getBody());
        verifyNoInteractions(fanout);
    }

    @Test
    void editAfterWindowIsForbiddenAndNothingIsBroadcast() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        clock.advance(Duration.ofHours(25));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.edit(projectId, m.getId(), author, "late"));

        assertEquals("Messages can only be edited within 24 hours", e.getReason());
        assertNull(m.getEditedAt());
        verifyNoInteractions(fanout);
    }

    @Test
    void editExactlyAtWindowEdgeIsAllowed() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        clock.advance(Duration.ofHours(24));

        ProjectMessageDto dto = service.edit(projectId, m.getId(), author, "just in time");

        assertEquals("just in time", dto.getBody());
        assertEquals(clock.instant(), dto.getEditedAt());
        assertEquals(OutboundEventType.MESSAGE_EDITED, capturedBroadcast(author).type());
    }

    @Test
    void editOneMillisecondPastWindowIsForbidden() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        clock.advance(Duration.ofHours(24).plusMillis(1));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.edit(projectId, m.getId(), author, "too late"));

        assertEquals(HttpStatus.FORBIDDEN, e.getStatusCode());
        assertEquals("original", m.getBody());
        verifyNoInteractions(fanout);
    }

    @Test
    void editWithinWindowUpdatesAndBroadcasts() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        when(readRepo.findByMessageIdOrderByReadAtAscIdAsc(m.getId())).thenReturn(List.of(
                ProjectMessageRead.builder().messageId(m.getId()).userId(other).readAt(clock.instant()).build()));
        clock.advance(Duration.ofHours(23));

        ProjectMessageDto dto = service.edit(projectId, m.getId(), author, "fixed");

        assertEquals("fixed", dto.getBody());
        assertEquals(clock.instant(), dto.getEditedAt());
        assertEquals(List.of(other), dto.getReadBy());
        Envelope env = capturedBroadcast(author);
        assertEquals(OutboundEventType.MESSAGE_EDITED, env.type());
    }

    @Test
    void blankEditIsRejected() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));

        assertThrows(ResponseStatusException.class, () -> service.edit(projectId, m.getId(), author, " "));
        assertEquals("original", m.getBody());
    }

    @Test
    void projectAdminMayDeleteOthersMessage() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        when(membership.isProjectAdmin(other, projectId)).thenReturn(true);

        service.delete(projectId, m.getId(), other);

        assertTrue(m.isDeleted());
        Envelope env = capturedBroadcast(other);
        assertEquals(OutboundEventType.MESSAGE_DELETED, env.type());
        assertEquals(m.getId(), env.get("message_id"));
    }

    @Test
    void plainMemberCannotDeleteOthersMessage() {
        ProjectMessage m = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));
        when(membership.isProjectAdmin(other, projectId)).thenReturn(false);

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.delete(projectId, m.getId(), other));

        assertEquals(HttpStatus.FORBIDDEN, e.getStatusCode());
        assertFalse(m.isDeleted());
    }

    @Test
    void deletingTwiceIsNotFound() {
        ProjectMessage m = existing(author, clock.instant());
        m.setDeletedAt(clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.delete(projectId, m.getId(), author));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
        verifyNoInteractions(fanout);
    }

    @Test
    void markReadStoresReadersAndBroadcastsToOthersOnce() {
        ProjectMessage cursor = existing(author, clock.instant());
        UUID earlier = UUID.randomUUID();
        when(messageRepo.findByIdAndProjectId(cursor.getId(), projectId)).thenReturn(Optional.of(cursor));
        when(messageRepo.findUnreadIdsUpTo(projectId, other, cursor.getCreatedAt()))
                .thenReturn(List.of(earlier, cursor.getId()));
        when(readRepo.insertIfAbsent(any(), eq(other), eq(clock.instant()))).thenReturn(1);

        ReadResult result = service.markRead(projectId, other, cursor.getId());

        assertTrue(result.changed());
        assertEquals(List.of(earlier, cursor.getId()), result.messageIds());
        verify(readRepo).insertIfAbsent(earlier, other, clock.instant());
        verify(readRepo).insertIfAbsent(cursor.getId(), other, clock.instant());

        // 읽은 본인 탭은 제외, sender 없음 -> is_own 개인화 없음
        ArgumentCaptor<Envelope> env = ArgumentCaptor.forClass(Envelope.class);
        verify(fanout).broadcastAfterCommit(eq(ScopeKey.project(projectId)), env.capture(), eq(other), isNull());
        assertEquals(OutboundEventType.READ, env.getValue().type());
        assertEquals(other, env.getValue().get("user_id"));
        assertEquals(cursor.getId(), env.getValue().get("message_id"));
        assertEquals(List.of(earlier, cursor.getId()), env.getValue().get("message_ids"));
    }

    @Test
    void markReadReportsOnlyRowsThisCallWrote() {
        ProjectMessage cursor = existing(author, clock.instant());
        UUID takenByConcurrentCall = UUID.randomUUID();
        when(messageRepo.findByIdAndProjectId(cursor.getId(), projectId)).thenReturn(Optional.of(cursor));
        when(messageRepo.findUnreadIdsUpTo(projectId, other, cursor.getCreatedAt()))
                .thenReturn(List.of(takenByConcurrentCall, cursor.getId()));
        when(readRepo.insertIfAbsent(takenByConcurrentCall, other, clock.instant())).thenReturn(0);
        when(readRepo.insertIfAbsent(cursor.getId(), other, clock.instant())).thenReturn(1);

        ReadResult result = service.markRead(projectId, other, cursor.getId());

        assertEquals(List.of(cursor.getId()), result.messageIds());
        ArgumentCaptor<Envelope> env = ArgumentCaptor.forClass(Envelope.class);
        verify(fanout).broadcastAfterCommit(eq(ScopeKey.project(projectId)), env.capture(), eq(other), isNull());
        assertEquals(List.of(cursor.getId()), env.getValue().get("message_ids"));
    }

    @Test
    void markReadLosingEveryRowToConcurrentCallIsSilent() {
        ProjectMessage cursor = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(cursor.getId(), projectId)).thenReturn(Optional.of(cursor));
        when(messageRepo.findUnreadIdsUpTo(projectId, other, cursor.getCreatedAt()))
                .thenReturn(List.of(cursor.getId()));
        when(readRepo.insertIfAbsent(cursor.getId(), other, clock.instant())).thenReturn(0);

        ReadResult result = service.markRead(projectId, other, cursor.getId());

        assertFalse(result.changed());
        verifyNoInteractions(fanout);
    }

    @Test
    void markReadWithNothingNewIsSilent() {
        ProjectMessage cursor = existing(author, clock.instant());
        when(messageRepo.findByIdAndProjectId(cursor.getId(), projectId)).thenReturn(Optional.of(cursor));
        when(messageRepo.findUnreadIdsUpTo(projectId, other, cursor.getCreatedAt())).thenReturn(List.of());

        ReadResult result = service.markRead(projectId, other, cursor.getId());

        assertFalse(result.changed());
        verifyNoInteractions(readRepo, fanout);
    }

    @Test
    void markReadWithUnknownCursorIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(messageRepo.findByIdAndProjectId(unknown, projectId)).thenReturn(Optional.empty());

        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> service.markRead(projectId, other, unknown));
        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
    }

    @Test
    void deletedMessageIsReturnedAsTombstone() {
        ProjectMessage m = existing(author, clock.instant());
        m.getAttachmentIds().add(UUID.randomUUID());
        m.setDeletedAt(clock.instant());
        when(messageRepo.findByIdAndProjectId(m.getId(), projectId)).thenReturn(Optional.of(m));

        ProjectMessageDto dto = service.findById(projectId, m.getId());

        assertNull(dto.getBody());
        assertTrue(dto.getAttachments().isEmpty());
        assertEquals(clock.instant(), dto.getDeletedAt());
    }
}
