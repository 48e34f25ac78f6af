package com.realtime.teamhub.chat.controller;

import com.realtime.teamhub.chat.dto.*;
import com.realtime.teamhub.chat.service.ChatAccess;
import com.realtime.teamhub.chat.service.DirectMessageService;
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
@RequestMapping("/api/chat/direct/conversations/{conversationId}")
public class DirectChatController {

    private final DirectMessageService messageService;
    private final TypingIndicatorService typingService;
    private final ChatAccess access;

    @PostMapping("/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public DirectMessageDto send(@PathVariable("conversationId") UUID conversationId,
                                 @Valid @RequestBody SendMessageRequest req,
                                 Authentication auth) {
        UUID me = participant(auth, conversationId);
        return messageService.send(conversationId, me, req.body(), req.attachments());
    }

    @GetMapping("/messages")
    public List<DirectMessageDto> history(@PathVariable("conversationId") UUID conversationId,
                                          @RequestParam(name = "limit", defaultValue = "50") int limit,
                                          @RequestParam(name = "before", required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
                                          Authentication auth) {
        participant(auth, conversationId);
        return messageService.history(conversationId, limit, before);
    }

    @GetMapping("/messages/{messageId}")
    public DirectMessageDto getOne(@PathVariable("conversationId") UUID conversationId,
                                   @PathVariable("messageId") UUID messageId,
                                   Authentication auth) {
        participant(auth, conversationId);
        return messageService.findById(conversationId, messageId);
    }

    @PatchMapping("/messages/{messageId}")
    public DirectMessageDto edit(@PathVariable("conversationId") UUID conversationId,
                                 @PathVariable("messageId") UUID messageId,
                                 @Valid @RequestBody EditMessageRequest req,
                                 Authentication auth) {
        UUID me = participant(auth, conversationId);
        return messageService.edit(conversationId, messageId, me, req.body());
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<Void> delete(@PathVariable("conversationId") UUID conversationId,
                                       @PathVariable("messageId") UUID messageId,
                                       Authentication auth) {
        UUID me = participant(auth, conversationId);
        messageService.delete(conversationId, messageId, me);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/typing")
    public ResponseEntity<Void> typing(@PathVariable("conversationId") UUID conversationId,
                                       @RequestBody TypingRequest req,
                                       Authentication auth) {
        UUID me = participant(auth, conversationId);
        typingService.update(ChatType.DIRECT, conversationId, me, req.typing());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/typing")
    public Set<UUID> typers(@PathVariable("conversationId") UUID conversationId, Authentication auth) {
        participant(auth, conversationId);
        return typingService.activeTypers(ChatType.DIRECT, conversationId);
    }

    @PostMapping("/read")
    public ReadResult markRead(@PathVariable("conversationId") UUID conversationId,
                               @Valid @RequestBody ReadRequest req,
                               Authentication auth) {
        UUID me = participant(auth, conversationId);
        return messageService.markRead(conversationId, me, req.lastReadMessageId());
    }

    private UUID participant(Authentication auth, UUID conversationId) {
        UUID me = UUID.fromString(auth.getName());
        access.requireConversation(me, conversationId);
        return me;
    }
}
