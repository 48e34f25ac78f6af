package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.dto.ConversationDto;
import com.realtime.teamhub.chat.dto.ConversationPage;
import com.realtime.teamhub.chat.dto.ProjectConversationDto;
import com.realtime.teamhub.chat.dto.UnreadCountDto;
import com.realtime.teamhub.chat.dto.UnreadSummary;
import com.realtime.teamhub.chat.entity.ChatConversation;
import com.realtime.teamhub.chat.entity.ProjectMessage;
import com.realtime.teamhub.chat.repository.ChatConversationRepository;
import com.realtime.teamhub.chat.repository.DirectMessageRepository;
import com.realtime.teamhub.chat.repository.ProjectMessageRepository;
import com.realtime.teamhub.chat.repository.UnreadCount;
import com.realtime.teamhub.membership.entity.ProjectMember;
import com.realtime.teamhub.membership.repository.ProjectMemberRepository;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import com.realtime.teamhub.typing.ChatType;
import com.realtime.teamhub.user.dto.UserSummary;
import com.realtime.teamhub.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 대화 목록/생성과 안 읽은 수 집계.
 * 안 읽은 수는 저장된 읽음 상태(project_message_reads, direct_messages.read_at)에서 바로 계산한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final int PREVIEW_LENGTH = 100;
    private static final Comparator<Instant> NEWEST_FIRST =
            Comparator.nullsLast(Comparator.<Instant>reverseOrder());

    private final ChatConversationRepository conversationRepo;
    private final DirectMessageRepository directRepo;
    private final ProjectMessageRepository projectRepo;
    private final ProjectMemberRepository projectMemberRepo;
    private final MembershipVerifier membership;
    private final UserDirectory userDirectory;
    private final MessagePolicy policy;

    /** 같은 조직의 두 사람 사이 대화를 찾거나 새로 만든다 */
    @Transactional
    public ConversationDto openDirect(UUID orgId, UUID senderId, UUID receiverId) {
        if (senderId.equals(receiverId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cannot create conversation with yourself");
        }
        if (!membership.isOrganizationMember(senderId, orgId) || !membership.isOrganizationMember(receiverId, orgId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Both users must belong to the same organization");
        }

        // 참여자 쌍 정규화: 어느 쪽이 먼저 열어도 같은 행
        boolean senderFirst = senderId.toString().compareTo(receiverId.toString()) < 0;
        UUID user1 = senderFirst ? senderId : receiverId;
        UUID user2 = senderFirst ? receiverId : senderId;

        ChatConversation conv = conversationRepo.findByOrganizationIdAndUser1IdAndUser2Id(orgId, user1, user2)
                .orElseGet(() -> {
                    Instant now = policy.now();
                    ChatConversation created = conversationRepo.save(ChatConversation.builder()
                            .organizationId(orgId)
                            .user1Id(user1)
                            .user2Id(user2)
                            .lastMessageAt(now)
                            .createdAt(now)
                            .build());
                    log.info("Conversation {} created in org {} ({} <-> {})", created.getId(), orgId, user1, user2);
                    return created;
                });

        long unread = unreadByConversation(orgId, senderId).getOrDefault(conv.getId(), 0L);
        return toDto(conv, userDirectory.summaryOf(conv.peerOf(senderId)), unread);
    }

    @Transactional(readOnly = true)
    public ConversationPage<ConversationDto> listDirect(UUID orgId, UUID userId, int limit, int offset) {
        int size = Math.min(100, Math.max(1, limit));
        int skip = Math.max(0, offset);
        // offset 이 limit 의 배수가 아니어도 되도록 한 페이지를 크게 잡고 잘라낸다
        Page<ChatConversation> page = conversationRepo.findForParticipant(orgId, userId,
                PageRequest.of(0, skip + size));
        List<ChatConversation> rows = page.getContent().stream().skip(skip).toList();

        Map<UUID, UserSummary> peers = userDirectory.summariesOf(
                rows.stream().map(c -> c.peerOf(userId)).collect(Collectors.toSet()));
        Map<UUID, Long> unread = rows.isEmpty() ? Map.of() : unreadByConversation(orgId, userId);

        List<ConversationDto> out = rows.stream()
                .map(c -> toDto(c, peers.get(c.peerOf(userId)), unread.getOrDefault(c.getId(), 0L)))
                .toList();
        return new ConversationPage<>(out, page.getTotalElements(), size, skip);
    }

    /** 조직 안에서 user 가 속한 프로젝트 채팅. 최근 메시지 순, 메시지 없는 프로젝트는 뒤로 */
    @Transactional(readOnly = true)
    public ConversationPage<ProjectConversationDto> listProjects(UUID orgId, UUID userId, int limit, int offset) {
        int size = Math.min(100, Math.max(1, limit));
        int skip = Math.max(0, offset);

        List<UUID> projectIds = projectMemberRepo.findByUserIdAndOrganizationId(userId, orgId).stream()
                .map(ProjectMember::getProjectId)
                .distinct()
                .toList();
        if (projectIds.isEmpty()) {
            return new ConversationPage<>(List.of(), 0, size, skip);
        }
        Map<UUID, Long> unread = projectRepo.countUnreadByProject(projectIds, userId).stream()
                .collect(Collectors.toMap(UnreadCount::getReferenceId, UnreadCount::getUnreadCount));

        List<ProjectConversationDto> all = projectIds.stream()
                .map(pid -> {
                    Optional<ProjectMessage> last = projectRepo.findFirstByProjectIdAndDeletedAtIsNullOrderByCreatedAtDesc(pid);
                    return new ProjectConversationDto(pid,
                            last.map(ProjectMessage::getCreatedAt).orElse(null),
                            last.map(m -> preview(m.getBody())).orElse(null),
                            unread.getOrDefault(pid, 0L));
                })
                .sorted(Comparator.comparing(ProjectConversationDto::lastMessageAt, NEWEST_FIRST))
                .toList();

        List<ProjectConversationDto> slice = all.stream().skip(skip).limit(size).toList();
        return new ConversationPage<>(slice, all.size(), size, skip);
    }

    /** 프로젝트 채팅 + DM 의 안 읽은 수 합계 */
    @Transactional(readOnly = true)
    public UnreadSummary unreadSummary(UUID orgId, UUID userId) {
        List<UUID> projectIds = projectMemberRepo.findByUserIdAndOrganizationId(userId, orgId).stream()
                .map(ProjectMember::getProjectId)
                .distinct()
                .toList();

        List<UnreadCountDto> projectChats = projectIds.isEmpty() ? List.of()
                : toCounts(ChatType.PROJECT, projectRepo.countUnreadByProject(projectIds, userId));
        List<UnreadCountDto> directMessages = toCounts(ChatType.DIRECT,
                directRepo.countUnreadByConversation(orgId, userId));

        long total = projectChats.stream().mapToLong(UnreadCountDto::unreadCount).sum()
                + directMessages.stream().mapToLong(UnreadCountDto::unreadCount).sum();
        return new UnreadSummary(total, projectChats, directMessages);
    }

    private Map<UUID, Long> unreadByConversation(UUID orgId, UUID userId) {
        return directRepo.countUnreadByConversation(orgId, userId).stream()
                .collect(Collectors.toMap(UnreadCount::getReferenceId, UnreadCount::getUnreadCount));
    }

    private static List<UnreadCountDto> toCounts(ChatType type, List<UnreadCount> rows) {
        return rows.stream()
                .filter(r -> r.getUnreadCount() != null && r.getUnreadCount() > 0)
                .map(r -> new UnreadCountDto(type, r.getReferenceId(), r.getUnreadCount(), r.getLastMessageAt()))
                .sorted(Comparator.comparing(UnreadCountDto::lastMessageAt, NEWEST_FIRST))
                .toList();
    }

    private static String preview(String body) {
        if (body == null || body.isBlank()) return "[File attachment]";
        return body.length() <= PREVIEW_LENGTH ? body : body.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static ConversationDto toDto(ChatConversation c, UserSummary other, long unread) {
        return new ConversationDto(c.getId(), c.getOrganizationId(), c.getUser1Id(), c.getUser2Id(),
                other, c.getLastMessageAt(), c.getCreatedAt(), unread);
    }
}
