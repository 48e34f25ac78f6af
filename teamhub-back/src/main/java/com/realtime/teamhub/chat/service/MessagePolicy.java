package com.realtime.teamhub.chat.service;

import com.realtime.teamhub.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** 프로젝트 채팅과 DM 이 공유하는 본문/첨부/수정 규칙 */
@Component
@RequiredArgsConstructor
public class MessagePolicy {

    private final RealtimeProperties props;
    private final Clock clock;

    public void validateContent(String body, List<UUID> attachments) {
        int count = attachments == null ? 0 : attachments.size();
        if ((body == null || body.isBlank()) && count == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Message must have either body text or attachments");
        }
        if (count > props.getMaxAttachments()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Too many attachments (max " + props.getMaxAttachments() + ")");
        }
        checkLength(body);
    }

    public void validateEditBody(String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message body must not be blank");
        }
        checkLength(body);
    }

    /** 작성자만, created_at 으로부터 편집 창 이내에만 */
    public void checkEditable(UUID authorId, UUID callerId, Instant createdAt) {
        if (!authorId.equals(callerId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You can only edit your own messages");
        }
        Duration age = Duration.between(createdAt, clock.instant());
        if (age.compareTo(props.getEditWindow()) > 0) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Messages can only be edited within " + props.getEditWindow().toHours() + " hours");
        }
    }

    public Instant now() {
        return clock.instant();
    }

    private void checkLength(String body) {
        if (body != null && body.length() > props.getMaxBodyLength()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Message body exceeds " + props.getMaxBodyLength() + " characters");
        }
    }
}
