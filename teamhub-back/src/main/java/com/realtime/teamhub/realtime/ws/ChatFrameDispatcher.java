package com.realtime.teamhub.realtime.ws;

import com.realtime.teamhub.chat.service.DirectMessageService;
import com.realtime.teamhub.chat.service.ProjectMessageService;
import com.realtime.teamhub.realtime.hub.Connection;
import com.realtime.teamhub.realtime.protocol.InboundFrame;
import com.realtime.teamhub.typing.ChatType;
import com.realtime.teamhub.typing.TypingIndicatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 채팅 소켓의 인바운드 프레임 처리. 결과는 모두 스코프 브로드캐스트로 돌아간다.
 * 규칙 위반은 ResponseStatusException 그대로 올려 핸들러가 error 프레임으로 바꾼다.
 */
@Component
@RequiredArgsConstructor
public class ChatFrameDispatcher {

    private final ProjectMessageService projectMessages;
    private final DirectMessageService directMessages;
    private final TypingIndicatorService typing;

    public void dispatch(Connection c, InboundFrame frame) {
        ChatType chatType = chatTypeOf(c);
        UUID refId = c.getScope().id();
        UUID userId = c.getUserId();

        switch (frame.type()) {
            case MESSAGE -> {
                if (chatType == ChatType.PROJECT) {
                    projectMessages.send(refId, userId, frame.body(), frame.attachments(), frame.replyToId());
                } else {
                    directMessages.send(refId, userId, frame.body(), frame.attachments());
                }
            }
            case TYPING -> typing.update(chatType, refId, userId, frame.typing());
            case READ -> {
                if (chatType == ChatType.PROJECT) {
                    projectMessages.markRead(refId, userId, frame.messageId());
                } else {
                    directMessages.markRead(refId, userId, frame.messageId());
                }
            }
        }
    }

    private static ChatType chatTypeOf(Connection c) {
        return switch (c.getScope().type()) {
            case PROJECT_CHAT -> ChatType.PROJECT;
            case DIRECT_MESSAGE -> ChatType.DIRECT;
            case INBOX -> throw new IllegalStateException("Inbox sockets do not accept chat frames");
        };
    }
}
