package com.realtime.teamhub.membership.service;

import java.util.UUID;

/**
 * 스코프 멤버십 확인. 조회 실패는 구현체가 false 로 처리한다.
 */
public interface MembershipVerifier {

    boolean isProjectMember(UUID userId, UUID projectId);

    /** 프로젝트 OWNER/ADMIN 여부 (타인 메시지 삭제 권한) */
    boolean isProjectAdmin(UUID userId, UUID projectId);

    boolean isConversationParticipant(UUID userId, UUID conversationId);

    boolean isOrganizationMember(UUID userId, UUID orgId);
}
