package com.realtime.teamhub.realtime.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** 소켓 프레임 ↔ {@link InboundFrame} / {@link Envelope} 변환. */
@Component
@RequiredArgsConstructor
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public InboundFrame decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FrameDecodingException("Invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameDecodingException("Invalid JSON");
        }

        String rawType = textOrNull(root.get("type"));
        if (rawType == null) {
            throw new FrameDecodingException("Missing event type");
        }
        InboundEventType type = InboundEventType.fromWire(rawType)
                .orElseThrow(() -> new FrameDecodingException("Unknown event type: " + rawType));

        return switch (type) {
            case MESSAGE -> InboundFrame.message(
                    textOrNull(root.get("body")),
                    uuidList(root.get("attachments")),
                    uuidOrNull(root.get("reply_to_id"), "reply_to_id"));
            case TYPING -> InboundFrame.typing(root.path("is_typing").asBoolean(false));
            case READ -> {
                UUID messageId = uuidOrNull(root.get("message_id"), "message_id");
                if (messageId == null) {
                    throw new FrameDecodingException("message_id is required");
                }
                yield InboundFrame.read(messageId);
            }
        };
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope.toWire());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope not serializable: " + envelope.type(), e);
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.asText();
    }

    private static UUID uuidOrNull(JsonNode node, String field) {
        String s = textOrNull(node);
        if (s == null || s.isBlank()) return null;
        try {
            return UUID.fromString(s.trim());
        } catch (IllegalArgumentException e) {
            throw new FrameDecodingException("Invalid " + field);
        }
    }

    private static List<UUID> uuidList(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) {
            throw new FrameDecodingException("attachments must be an array");
        }
        List<UUID> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            out.add(uuidOrNull(item, "attachment id"));
        }
        if (out.contains(null)) {
            throw new FrameDecodingException("Invalid attachment id");
        }
        return out;
    }
}
