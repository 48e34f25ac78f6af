package com.realtime.teamhub.inbox.service;

import com.realtime.teamhub.inbox.dto.NewInboxItem;
import com.realtime.teamhub.inbox.entity.InboxEventType;
import com.realtime.teamhub.membership.entity.ProjectMember;
import com.realtime.teamhub.membership.repository.ProjectMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * 도메인 이벤트 → 인박스 항목. 요청 스레드를 막지 않도록 notifyExecutor 에서 실행한다.
 * 실패는 로그만 남긴다 (호출한 작업은 이미 끝났음).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final int PREVIEW_LENGTH = 100;

    private final InboxService inboxService;
    private final ProjectMemberRepository projectMemberRepo;

    @Async("notifyExecutor")
    public void notifyOrganizationInvitation(UUID userId, UUID orgId, String orgName,
                                             UUID inviterId, String inviterName) {
        send(NewInboxItem.builder()
                .userId(userId).orgId(orgId).userBy(inviterId)
                .title("Invitation to " + orgName)
                .message(inviterName + " has invited you to join " + orgName)
                .eventType(InboxEventType.ORGANIZATION_INVITATION)
                .referenceId(orgId)
                .build());
    }

    @Async("notifyExecutor")
    public void notifyProjectMemberAdded(UUID userId, UUID orgId, UUID projectId, String projectName,
                                         UUID addedById, String addedByName) {
        send(NewInboxItem.builder()
                .userId(userId).orgId(orgId).userBy(addedById)
                .title("Added to " + projectName)
                .message(addedByName + " added you to project " + projectName)
                .eventType(InboxEventType.PROJECT_MEMBER_ADDED)
                .referenceId(projectId)
                .build());
    }

    @Async("notifyExecutor")
    public void notifyTaskAssigned(UUID userId, UUID orgId, UUID taskId, String taskTitle,
                                   UUID assignedById, String assignedByName, String projectName) {
        send(NewInboxItem.builder()
                .userId(userId).orgId(orgId).userBy(assignedById)
                .title("Task Assigned: " + taskTitle)
                .message(assignedByName + " assigned you a task '" + taskTitle + "' in project " + projectName)
                .eventType(InboxEventType.TASK_ASSIGNED)
                .referenceId(taskId)
                .build());
    }

    @Async("notifyExecutor")
    public void notifyTaskUnassigned(UUID userId, UUID orgId, UUID taskId, String taskTitle,
                                     UUID unassignedById, String unassignedByName, String projectName) {
        send(NewInboxItem.builder()
                .userId(userId).orgId(orgId).userBy(unassignedById)
                .title("Task Unassigned: " + taskTitle)
                .message(unassignedByName + " unassigned you from task '" + taskTitle + "' in project " + projectName)
                .eventType(InboxEventType.TASK_UNASSIGNED)
                .referenceId(taskId)
                .build());
    }

    /** 완료한 사람을 제외한 프로젝트 멤버 전원에게 */
    @Async("notifyExecutor")
    public void notifyTaskCompleted(UUID projectId, UUID orgId, UUID taskId, String taskTitle,
                                    UUID completedById, String completedByName, String projectName) {
        var members = projectMemberRepo.findByProjectId(projectId);
        if (members.isEmpty()) {
            log.warn("No project members found for project {}", projectId);
            return;
        }
        String title = "Task Completed: " + taskTitle;
        String message = completedByName + " completed task '" + taskTitle + "' in project " + projectName;
        for (ProjectMember m : members) {
            if (m.getUserId().equals(completedById)) continue;
            send(NewInboxItem.builder()
                    .userId(m.getUserId()).orgId(orgId).userBy(completedById)
                    .title(title)
                    .message(message)
                    .eventType(InboxEventType.TASK_COMPLETED)
                    .referenceId(taskId)
                    .build());
        }
    }

    @Async("notifyExecutor")
    public void notifyDirectMessage(UUID userId, UUID orgId, UUID senderId, String senderName,
                                    String messagePreview, UUID conversationId) {
        String preview = messagePreview == null ? "" : messagePreview;
        if (preview.length() > PREVIEW_LENGTH) preview = preview.substring(0, PREVIEW_LENGTH);
        send(NewInboxItem.builder()
                .userId(userId).orgId(orgId).userBy(senderId)
                .title("New message from " + senderName)
                .message(senderName + ": " + preview)
                .eventType(InboxEventType.DIRECT_MESSAGE)
                .referenceId(conversationId)
                .build());
    }

    private void send(NewInboxItem item) {
        try {
            inboxService.create(item);
        } catch (Exception e) {
            log.error("Failed to create inbox notification ({}) for user {}", item.eventType(), item.userId(), e);
        }
    }
}
