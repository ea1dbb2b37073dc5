package com.quichat.messaging;

import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.EnvelopeKind;

import java.util.Objects;

/**
 * Result of classifying a decoded {@link Envelope}.
 * {@code payload} is the chat text for {@link EnvelopeKind#CHAT}, the probe id for
 * probes and replies, and empty for presence.
 */
public final class Classification {

    private final EnvelopeKind kind;
    private final String payload;
    private final boolean local;
    private final Envelope envelope;

    Classification(EnvelopeKind kind, String payload, boolean local, Envelope envelope) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
        this.local = local;
        this.envelope = Objects.requireNonNull(envelope, "envelope cannot be null");
    }

    public EnvelopeKind getKind() { return kind; }
    public String getPayload() { return payload; }
    public boolean isLocal() { return local; }
    public Envelope getEnvelope() { return envelope; }

    /**
     * True for presence, probe and probe reply envelopes.
     */
    public boolean isControl() {
        return kind != EnvelopeKind.CHAT;
    }

    @Override
    public String toString() {
        return "Classification{kind=" + kind + ", payload='" + payload + "', local=" + local + '}';
    }
}
