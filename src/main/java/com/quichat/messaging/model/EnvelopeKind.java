package com.quichat.messaging.model;

/**
 * Explicit discriminant carried in the {@code kind} field of an {@link Envelope}.
 * Envelopes from peers that predate the field have no kind and are classified
 * by the reserved text prefixes instead.
 */
public enum EnvelopeKind {
    CHAT,
    PRESENCE,    // one-time "joined" announcement
    PROBE,       // latency probe, text carries the probe id
    PROBE_REPLY  // echo of a probe id back to its originator
}
