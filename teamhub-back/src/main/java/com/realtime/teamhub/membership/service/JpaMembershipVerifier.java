package com.realtime.teamhub.membership.service;

import com.realtime.teamhub.chat.repository.ChatConversationRepository;
import com.realtime.teamhub.membership.repository.OrganizationMemberRepository;
import com.realtime.teamhub.membership.repository.ProjectMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.function.BooleanSupplier;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMembershipVerifier implements MembershipVerifier {

    private final ProjectMemberRepository projectMemberRepo;
    private final OrganizationMemberRepository orgMemberRepo;
    private final ChatConversationRepository conversationRepo;

    @Override
    public boolean isProjectMember(UUID userId, UUID projectId) {
        return check("project member", () -> projectMemberRepo.existsByProjectIdAndUserId(projectId, userId));
    }

    @Override
    public boolean isProjectAdmin(UUID userId, UUID projectId) {
        return check("project admin", () -> projectMemberRepo.findByProjectIdAndUserId(projectId, userId)
                .map(m -> m.getRole() != null && m.getRole().isAdmin())
                .orElse(false));
    }

    @Override
    public boolean isConversationParticipant(UUID userId, UUID conversationId) {
        return check("conversation participant", () -> conversationRepo.findById(conversationId)
                .map(c -> c.hasParticipant(userId))
                .orElse(false));
    }

    @Override
    public boolean isOrganizationMember(UUID userId, UUID orgId) {
        return check("organization member", () -> orgMemberRepo.existsByOrgIdAndUserId(orgId, userId));
    }

    private static boolean check(String what, BooleanSupplier lookup) {
        try {
            return lookup.getAsBoolean();
        } catch (Exception e) {
            log.error("{} lookup failed", what, e);
            return false;
        }
    }
}
