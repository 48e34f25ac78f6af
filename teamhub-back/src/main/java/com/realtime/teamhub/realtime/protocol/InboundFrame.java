package com.realtime.teamhub.realtime.protocol;

import java.util.List;
import java.util.UUID;

/**
 * 디코딩된 인바운드 프레임. type 별로 의미 있는 필드만 채워진다.
 * <ul>
 *   <li>MESSAGE: body, attachments, replyToId</li>
 *   <li>TYPING: typing</li>
 *   <li>READ: messageId</li>
 * </ul>
 */
public record InboundFrame(
        InboundEventType type,
        String body,
        List<UUID> attachments,
        UUID replyToId,
        boolean typing,
        UUID messageId
) {
    public static InboundFrame message(String body, List<UUID> attachments, UUID replyToId) {
        return new InboundFrame(InboundEventType.MESSAGE, body, List.copyOf(attachments), replyToId, false, null);
    }

    public static InboundFrame typing(boolean isTyping) {
        return new InboundFrame(InboundEventType.TYPING, null, List.of(), null, isTyping, null);
    }

    public static InboundFrame read(UUID messageId) {
        return new InboundFrame(InboundEventType.READ, null, List.of(), null, false, messageId);
    }
}
