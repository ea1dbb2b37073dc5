package com.quichat.messaging;

import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.EnvelopeKind;
import com.quichat.messaging.model.LocalIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ControlClassifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private ControlClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ControlClassifier(new LocalIdentity("alice", "sid-alice"));
    }

    @Test
    void testClassify_TaggedEnvelopes() {
        Classification presence = classifier.classify(Envelope.presence("bob", "sid-bob", NOW));
        assertEquals(EnvelopeKind.PRESENCE, presence.getKind());
        assertEquals("", presence.getPayload());

        Classification probe = classifier.classify(Envelope.probe("bob", "sid-bob", "ab12cd34", NOW));
        assertEquals(EnvelopeKind.PROBE, probe.getKind());
        assertEquals("ab12cd34", probe.getPayload());

        Classification reply = classifier.classify(Envelope.probeReply("bob", "sid-bob", "ab12cd34", NOW));
        assertEquals(EnvelopeKind.PROBE_REPLY, reply.getKind());
        assertEquals("ab12cd34", reply.getPayload());

        Classification chat = classifier.classify(Envelope.chat("bob", "sid-bob", "hello", NOW));
        assertEquals(EnvelopeKind.CHAT, chat.getKind());
        assertEquals("hello", chat.getPayload());
        assertFalse(chat.isControl());
    }

    @Test
    void testClassify_TaggedChatThatLooksLikeControlStaysChat() {
        Classification chat = classifier.classify(Envelope.chat("bob", "sid-bob", "__PING__deadbeef", NOW));

        assertEquals(EnvelopeKind.CHAT, chat.getKind());
        assertEquals("__PING__deadbeef", chat.getPayload());
    }

    @Test
    void testClassify_UntaggedEnvelopesUsePrefixes() {
        assertEquals(EnvelopeKind.PRESENCE, classifier.classify(untagged("bob", "__JOIN__")).getKind());

        Classification probe = classifier.classify(untagged("bob", "__PING__ffff0000"));
        assertEquals(EnvelopeKind.PROBE, probe.getKind());
        assertEquals("ffff0000", probe.getPayload());

        Classification reply = classifier.classify(untagged("bob", "__PONG__ffff0000"));
        assertEquals(EnvelopeKind.PROBE_REPLY, reply.getKind());
        assertEquals("ffff0000", reply.getPayload());

        Classification chat = classifier.classify(untagged("bob", "__JOIN__ please"));
        assertEquals(EnvelopeKind.CHAT, chat.getKind());
    }

    @Test
    void testIsLocal_UsesSessionIdNotNick() {
        assertTrue(classifier.classify(Envelope.probe("alice", "sid-alice", "x", NOW)).isLocal());
        // A different peer that also calls itself alice is still remote.
        assertFalse(classifier.classify(Envelope.probe("alice", "sid-other", "x", NOW)).isLocal());
        assertFalse(classifier.classify(Envelope.probe("bob", "sid-bob", "x", NOW)).isLocal());
    }

    @Test
    void testIsLocal_FallsBackToNickWithoutSessionId() {
        assertTrue(classifier.classify(untagged("alice", "__PING__x")).isLocal());
        assertFalse(classifier.classify(untagged("bob", "__PING__x")).isLocal());
    }

    private static Envelope untagged(String nick, String text) {
        return new Envelope(null, nick, null, text, NOW);
    }
}
