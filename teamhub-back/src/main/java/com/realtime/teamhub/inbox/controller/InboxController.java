package com.realtime.teamhub.inbox.controller;

import com.realtime.teamhub.inbox.dto.InboxItemDto;
import com.realtime.teamhub.inbox.dto.InboxPage;
import com.realtime.teamhub.inbox.service.InboxService;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/inbox")
public class InboxController {

    private final InboxService inboxService;
    private final MembershipVerifier membership;

    @GetMapping("/{orgId}")
    public InboxPage list(@PathVariable("orgId") UUID orgId,
                          @RequestParam(name = "archived", defaultValue = "false") boolean archived,
                          @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly,
                          @RequestParam(name = "page", defaultValue = "0") int page,
                          @RequestParam(name = "size", defaultValue = "20") int size,
                          Authentication auth) {
        UUID me = requireOrgMember(auth, orgId);
        return inboxService.list(me, orgId, archived, unreadOnly, page, size);
    }

    @GetMapping("/{orgId}/unread-count")
    public Map<String, Long> unreadCount(@PathVariable("orgId") UUID orgId, Authentication auth) {
        UUID me = requireOrgMember(auth, orgId);
        return Map.of("count", inboxService.unreadCount(me, orgId));
    }

    @PostMapping("/items/{id}/read")
    public InboxItemDto markRead(@PathVariable("id") UUID id, Authentication auth) {
        return inboxService.markRead(id, UUID.fromString(auth.getName()));
    }

    @PostMapping("/items/{id}/archive")
    public InboxItemDto archive(@PathVariable("id") UUID id, Authentication auth) {
        return inboxService.archive(id, UUID.fromString(auth.getName()));
    }

    @PostMapping("/items/{id}/unarchive")
    public InboxItemDto unarchive(@PathVariable("id") UUID id, Authentication auth) {
        return inboxService.unarchive(id, UUID.fromString(auth.getName()));
    }

    @DeleteMapping("/items/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id, Authentication auth) {
        inboxService.delete(id, UUID.fromString(auth.getName()));
        return ResponseEntity.noContent().build();
    }

    private UUID requireOrgMember(Authentication auth, UUID orgId) {
        UUID me = UUID.fromString(auth.getName()); // name = UUID 문자열
        if (!membership.isOrganizationMember(me, orgId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a member of this organization");
        }
        return me;
    }
}
