package com.quichat.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.EnvelopeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeCodecTest.class);

    private EnvelopeCodec codec;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec();
    }

    @Test
    void testRoundTrip_PreservesEveryField() {
        Instant sentAt = Instant.parse("2024-05-01T10:15:30.123456789Z");
        Envelope[] envelopes = {
                Envelope.chat("alice", "sid-a", "hello\nworld", sentAt),
                Envelope.presence("alice", "sid-a", sentAt),
                Envelope.probe("alice", "sid-a", "ab12cd34", sentAt),
                Envelope.probeReply("bob", "sid-b", "ab12cd34", sentAt),
                new Envelope(null, "carol", null, "legacy text", sentAt)
        };
        for (Envelope envelope : envelopes) {
            Optional<Envelope> decoded = codec.decode(codec.encode(envelope));
            assertEquals(Optional.of(envelope), decoded, "Round trip should preserve " + envelope);
        }
    }

    @Test
    void testEncode_UsesWireFieldNamesAndRfc3339Timestamp() throws Exception {
        Envelope envelope = Envelope.chat("alice", "sid-a", "hi", Instant.parse("2024-05-01T10:15:30Z"));

        JsonNode json = new ObjectMapper().readTree(codec.encode(envelope));
        logger.info("Encoded envelope: {}", json);

        assertEquals("CHAT", json.get("kind").asText());
        assertEquals("alice", json.get("nick").asText());
        assertEquals("sid-a", json.get("sid").asText());
        assertEquals("hi", json.get("text").asText());
        assertEquals("2024-05-01T10:15:30Z", json.get("ts").asText());
    }

    @Test
    void testEncode_OmitsAbsentKindAndSessionId() throws Exception {
        Envelope legacy = new Envelope(null, "alice", null, "hi", Instant.parse("2024-05-01T10:15:30Z"));

        JsonNode json = new ObjectMapper().readTree(codec.encode(legacy));

        assertFalse(json.has("kind"));
        assertFalse(json.has("sid"));
    }

    @Test
    void testDecode_LegacyEnvelopeWithoutKindOrSessionId() {
        String legacy = "{\"nick\":\"bob\",\"text\":\"__PING__ab12cd34\",\"ts\":\"2024-05-01T10:15:30.123456789Z\"}";

        Optional<Envelope> decoded = codec.decode(legacy.getBytes(StandardCharsets.UTF_8));

        assertTrue(decoded.isPresent());
        assertNull(decoded.get().getKind());
        assertNull(decoded.get().getSessionId());
        assertEquals("bob", decoded.get().getNick());
        assertEquals("__PING__ab12cd34", decoded.get().getText());
        assertEquals(Instant.parse("2024-05-01T10:15:30.123456789Z"), decoded.get().getSentAt());
    }

    @Test
    void testDecode_IgnoresUnknownFields() {
        String json = "{\"kind\":\"PRESENCE\",\"nick\":\"bob\",\"text\":\"__JOIN__\",\"ts\":\"2024-05-01T10:15:30Z\",\"extra\":42}";

        Optional<Envelope> decoded = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertTrue(decoded.isPresent());
        assertEquals(EnvelopeKind.PRESENCE, decoded.get().getKind());
    }

    @Test
    void testDecode_MalformedBytesAreDiscarded() {
        byte[][] garbage = {
                "not json".getBytes(StandardCharsets.UTF_8),
                "{\"nick\":\"bob\"".getBytes(StandardCharsets.UTF_8),
                "{\"nick\":\"bob\",\"ts\":\"2024-05-01T10:15:30Z\"}".getBytes(StandardCharsets.UTF_8),
                "{\"nick\":\"bob\",\"text\":\"x\",\"ts\":\"yesterday\"}".getBytes(StandardCharsets.UTF_8),
                "{\"kind\":\"SHOUT\",\"nick\":\"bob\",\"text\":\"x\",\"ts\":\"2024-05-01T10:15:30Z\"}".getBytes(StandardCharsets.UTF_8),
                "[1,2,3]".getBytes(StandardCharsets.UTF_8),
                "null".getBytes(StandardCharsets.UTF_8),
                new byte[]{(byte) 0xff, (byte) 0xfe, 0x00, 0x01},
                new byte[0],
                null
        };
        for (byte[] datum : garbage) {
            assertTrue(codec.decode(datum).isEmpty(), "Datum should be discarded");
        }
    }
}
