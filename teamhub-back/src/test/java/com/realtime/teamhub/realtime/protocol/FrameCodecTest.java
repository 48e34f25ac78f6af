package com.realtime.teamhub.realtime.protocol;

import com.realtime.teamhub.support.RecordingSessions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec(RecordingSessions.MAPPER);

    @Test
    void decodesMessageFrame() {
        UUID att = UUID.randomUUID();
        UUID reply = UUID.randomUUID();
        InboundFrame f = codec.decode("{\"type\":\"message\",\"body\":\"hello\",\"attachments\":[\"" + att
                + "\"],\"reply_to_id\":\"" + reply + "\"}");

        assertEquals(InboundEventType.MESSAGE, f.type());
        assertEquals("hello", f.body());
        assertEquals(List.of(att), f.attachments());
        assertEquals(reply, f.replyToId());
    }

    @Test
    void messageWithoutOptionalFields() {
        InboundFrame f = codec.decode("{\"type\":\"message\",\"body\":\"x\"}");
        assertTrue(f.attachments().isEmpty());
        assertNull(f.replyToId());
    }

    @Test
    void typingDefaultsToFalse() {
        assertFalse(codec.decode("{\"type\":\"typing\"}").typing());
        assertTrue(codec.decode("{\"type\":\"typing\",\"is_typing\":true}").typing());
    }

    @Test
    void readRequiresMessageId() {
        FrameDecodingException e = assertThrows(FrameDecodingException.class,
                () -> codec.decode("{\"type\":\"read\"}"));
        assertEquals("message_id is required", e.getMessage());

        UUID id = UUID.randomUUID();
        assertEquals(id, codec.decode("{\"type\":\"read\",\"message_id\":\"" + id + "\"}").messageId());
    }

    @Test
    void malformedJsonIsRejected() {
        assertEquals("Invalid JSON",
                assertThrows(FrameDecodingException.class, () -> codec.decode("{not json")).getMessage());
        assertEquals("Invalid JSON",
                assertThrows(FrameDecodingException.class, () -> codec.decode("[1,2]")).getMessage());
    }

    @Test
    void unknownAndMissingTypes() {
        assertEquals("Unknown event type: dance",
                assertThrows(FrameDecodingException.class, () -> codec.decode("{\"type\":\"dance\"}")).getMessage());
        assertEquals("Missing event type",
                assertThrows(FrameDecodingException.class, () -> codec.decode("{\"body\":\"x\"}")).getMessage());
    }

    @Test
    void badAttachmentIds() {
        assertEquals("attachments must be an array", assertThrows(FrameDecodingException.class,
                () -> codec.decode("{\"type\":\"message\",\"attachments\":\"abc\"}")).getMessage());
        assertEquals("Invalid attachment id", assertThrows(FrameDecodingException.class,
                () -> codec.decode("{\"type\":\"message\",\"attachments\":[\"nope\"]}")).getMessage());
    }

    @Test
    void encodePutsTypeFirst() {
        String json = codec.encode(Envelope.error("Invalid JSON"));
        assertEquals("{\"type\":\"error\",\"message\":\"Invalid JSON\"}", json);
    }
}
