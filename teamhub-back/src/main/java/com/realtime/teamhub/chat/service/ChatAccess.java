package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.chat.entity.ChatConversation;
import com.realtime.teamhub.chat.repository.ChatConversationRepository;
import com.realtime.teamhub.membership.service.MembershipVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/** REST 경로의 스코프 접근 확인 (소켓은 핸드셰이크에서 한 번 확인) */
@Component
@RequiredArgsConstructor
public class ChatAccess {

    private final MembershipVerifier membership;
    private final ChatConversationRepository conversationRepo;

    public void requireProjectMember(UUID userId, UUID projectId) {
        if (!membership.isProjectMember(userId, projectId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a member of this project");
        }
    }

    public ChatConversation requireConversation(UUID userId, UUID conversationId) {
        ChatConversation conv = conversationRepo.findById(conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
        if (!conv.hasParticipant(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a participant of this conversation");
        }
        return conv;
    }
}
