package com.realtime.teamhub.chat.bridge;

import com.realtime.teamhub.realtime.hub.ConnectionHub;
import com.realtime.teamhub.realtime.hub.ScopeKey;
import com.realtime.teamhub.realtime.protocol.Envelope;
import com.realtime.teamhub.realtime.protocol.FrameCodec;
import com.realtime.teamhub.realtime.protocol.OutboundEventType;
import com.realtime.teamhub.support.MutableClock;
import com.realtime.teamhub.support.RecordingSessions;
import com.realtime.teamhub.support.RecordingSessions.Recorded;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ScopeBroadcastBridgeTest {

    private final ConnectionHub hub = new ConnectionHub(new FrameCodec(RecordingSessions.MAPPER),
            new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    private final ScopeBroadcastBridge bridge = new ScopeBroadcastBridge(hub);

    @Test
    void replaysIntoLocalHubWithPersonalization() {
        ScopeKey scope = ScopeKey.direct(UUID.randomUUID());
        UUID sender = UUID.randomUUID();
        UUID peer = UUID.randomUUID();
        Recorded senderTab = RecordingSessions.open();
        Recorded peerTab = RecordingSessions.open();
        hub.connect(scope, sender, senderTab.session);
        hub.connect(scope, peer, peerTab.session);

        Envelope env = Envelope.of(OutboundEventType.MESSAGE_DELETED).with("message_id", "m-1");
        bridge.onBroadcast(ScopeBroadcast.of(scope, env, null, sender));

        assertEquals(true, senderTab.last().get("is_own_message"));
        assertEquals(false, peerTab.last().get("is_own_message"));
        assertEquals("m-1", peerTab.last().get("message_id"));
    }

    @Test
    void typingExclusionSurvivesTheHop() {
        ScopeKey scope = ScopeKey.project(UUID.randomUUID());
        UUID typist = UUID.randomUUID();
        Recorded typistTab = RecordingSessions.open();
        Recorded otherTab = RecordingSessions.open();
        hub.connect(scope, typist, typistTab.session);
        hub.connect(scope, UUID.randomUUID(), otherTab.session);

        bridge.onBroadcast(new ScopeBroadcast(scope.type(), scope.id(), "typing",
                Map.of("user_id", typist.toString(), "is_typing", true), typist, null));

        assertTrue(typistTab.frames.isEmpty());
        assertEquals(true, otherTab.last().get("is_typing"));
    }

    @Test
    void unknownTypeIsDropped() {
        ScopeKey scope = ScopeKey.project(UUID.randomUUID());
        Recorded tab = RecordingSessions.open();
        hub.connect(scope, UUID.randomUUID(), tab.session);

        bridge.onBroadcast(new ScopeBroadcast(scope.type(), scope.id(), "bogus", Map.of(), null, null));

        assertTrue(tab.frames.isEmpty());
    }
}
