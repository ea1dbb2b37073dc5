package com.quichat.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quichat.messaging.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON codec for {@link Envelope}s. Timestamps are written as RFC 3339 strings.
 */
@Component
public class EnvelopeCodec {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeCodec.class);

    private final ObjectMapper objectMapper;

    public EnvelopeCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    /**
     * Serializes an envelope to UTF-8 JSON bytes.
     *
     * @param envelope the envelope to write
     * @return the wire bytes
     * @throws EnvelopeCodecException if Jackson cannot serialize the envelope
     */
    public byte[] encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("Failed to encode envelope " + envelope, e);
        }
    }

    /**
     * Parses wire bytes into an envelope.
     *
     * @param data raw bytes received from the topic
     * @return the envelope, or empty when the bytes are not a valid envelope
     */
    public Optional<Envelope> decode(byte[] data) {
        if (data == null || data.length == 0) {
            logger.debug("Discarding empty datum.");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(data, Envelope.class));
        } catch (IOException e) {
            // Jackson surfaces constructor null checks as ValueInstantiationException, an IOException.
            logger.warn("Discarding malformed envelope ({} bytes): {}", data.length, e.getMessage());
            return Optional.empty();
        }
    }
}
