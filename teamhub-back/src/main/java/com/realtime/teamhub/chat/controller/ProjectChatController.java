package com.realtime.teamhub.chat.controller;

import com.realtime.teamhub.chat.dto.*;
import com.realtime.teamhub.chat.service.ChatAccess;
import com.realtime.teamhub.chat.service.ProjectMessageService;
import com.realtime.teamhub.typing.ChatType;
import com.realtime.teamhub.typing.TypingIndicatorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat/projects/{projectId}")
public class ProjectChatController {

    private final ProjectMessageService messageService;
    private final TypingIndicatorService typingService;
    private final ChatAccess access;

    @PostMapping("/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectMessageDto send(@PathVariable("projectId") UUID projectId,
                                  @Valid @RequestBody SendMessageRequest req,
                                  Authentication auth) {
        UUID me = member(auth, projectId);
        return messageService.send(projectId, me, req.body(), req.attachments(), req.replyToId());
    }

    /** 최신순. before 는 ISO-8601 시각 커서 */
    @GetMapping("/messages")
    public List<ProjectMessageDto> history(@PathVariable("projectId") UUID projectId,
                                           @RequestParam(name = "limit", defaultValue = "50") int limit,
                                           @RequestParam(name = "before", required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
                                           Authentication auth) {
        member(auth, projectId);
        return messageService.history(projectId, limit, before);
    }

    @GetMapping("/messages/{messageId}")
    public ProjectMessageDto getOne(@PathVariable("projectId") UUID projectId,
                                    @PathVariable("messageId") UUID messageId,
                                    Authentication auth) {
        member(auth, projectId);
        return messageService.findById(projectId, messageId);
    }

    @PatchMapping("/messages/{messageId}")
    public ProjectMessageDto edit(@PathVariable("projectId") UUID projectId,
                                  @PathVariable("messageId") UUID messageId,
                                  @Valid @RequestBody EditMessageRequest req,
                                  Authentication auth) {
        UUID me = member(auth, projectId);
        return messageService.edit(projectId, messageId, me, req.body());
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<Void> delete(@PathVariable("projectId") UUID projectId,
                                       @PathVariable("messageId") UUID messageId,
                                       Authentication auth) {
        UUID me = member(auth, projectId);
        messageService.delete(projectId, messageId, me);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/typing")
    public ResponseEntity<Void> typing(@PathVariable("projectId") UUID projectId,
                                       @RequestBody TypingRequest req,
                                       Authentication auth) {
        UUID me = member(auth, projectId);
        typingService.update(ChatType.PROJECT, projectId, me, req.typing());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/typing")
    public Set<UUID> typers(@PathVariable("projectId") UUID projectId, Authentication auth) {
        member(auth, projectId);
        return typingService.activeTypers(ChatType.PROJECT, projectId);
    }

    @PostMapping("/read")
    public ReadResult markRead(@PathVariable("projectId") UUID projectId,
                               @Valid @RequestBody ReadRequest req,
                               Authentication auth) {
        UUID me = member(auth, projectId);
        return messageService.markRead(projectId, me, req.lastReadMessageId());
    }

    private UUID member(Authentication auth, UUID projectId) {
        UUID me = UUID.fromString(auth.getName()); // name = UUID 문자열
        access.requireProjectMember(me, projectId);
        return me;
    }
}
