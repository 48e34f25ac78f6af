package com.realtime.teamhub.chat.controller;

import com.realtime.teamhub.chat.dto.*;
import com.realtime.teamhub.chat.service.ConversationService;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat/organizations/{orgId}")
public class ConversationController {

    private final ConversationService conversationService;
    private final MembershipVerifier membership;

    /** 이미 있으면 기존 대화를 그대로 돌려준다 */
    @PostMapping("/direct/conversations")
    public ConversationDto open(@PathVariable("orgId") UUID orgId,
                                @Valid @RequestBody OpenConversationRequest req,
                                Authentication auth) {
        UUID me = UUID.fromString(auth.getName());
        return conversationService.openDirect(orgId, me, req.receiverId());
    }

    @GetMapping("/direct/conversations")
    public ConversationPage<ConversationDto> direct(@PathVariable("orgId") UUID orgId,
                                                    @RequestParam(name = "limit", defaultValue = "50") int limit,
                                                    @RequestParam(name = "offset", defaultValue = "0") int offset,
                                                    Authentication auth) {
        UUID me = requireOrgMember(auth, orgId);
        return conversationService.listDirect(orgId, me, limit, offset);
    }

    @GetMapping("/project/conversations")
    public ConversationPage<ProjectConversationDto> projects(@PathVariable("orgId") UUID orgId,
                                                             @RequestParam(name = "limit", defaultValue = "50") int limit,
                                                             @RequestParam(name = "offset", defaultValue = "0") int offset,
                                                             Authentication auth) {
        UUID me = requireOrgMember(auth, orgId);
        return conversationService.listProjects(orgId, me, limit, offset);
    }

    @GetMapping("/unread-summary")
    public UnreadSummary unreadSummary(@PathVariable("orgId") UUID orgId, Authentication auth) {
        UUID me = requireOrgMember(auth, orgId);
        return conversationService.unreadSummary(orgId, me);
    }

    private UUID requireOrgMember(Authentication auth, UUID orgId) {
        UUID me = UUID.fromString(auth.getName());
        if (!membership.isOrganizationMember(me, orgId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a member of this organization");
        }
        return me;
    }
}
