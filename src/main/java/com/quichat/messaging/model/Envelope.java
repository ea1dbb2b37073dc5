package com.quichat.messaging.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * The unit exchanged over the shared topic.
 * Wire form: {@code {"kind": ..., "nick": ..., "sid": ..., "text": ..., "ts": RFC3339}}.
 * {@code kind} and {@code sid} are absent on envelopes written by older peers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"kind", "nick", "sid", "text", "ts"})
public final class Envelope {

    public static final String PRESENCE_TOKEN = "__JOIN__";
    public static final String PROBE_PREFIX = "__PING__";
    public static final String PROBE_REPLY_PREFIX = "__PONG__";

    private final EnvelopeKind kind;
    private final String nick;
    private final String sessionId;
    private final String text;
    private final Instant sentAt;

    @JsonCreator
    public Envelope(
            @JsonProperty("kind") EnvelopeKind kind,
            @JsonProperty("nick") String nick,
            @JsonProperty("sid") String sessionId,
            @JsonProperty("text") String text,
            @JsonProperty("ts") Instant sentAt) {
        this.kind = kind;
        this.nick = Objects.requireNonNull(nick, "nick cannot be null");
        this.sessionId = sessionId;
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.sentAt = Objects.requireNonNull(sentAt, "ts cannot be null");
    }

    // Control envelopes keep the legacy text so that untagged peers still understand them.

    public static Envelope chat(String nick, String sessionId, String text, Instant sentAt) {
        return new Envelope(EnvelopeKind.CHAT, nick, sessionId, text, sentAt);
    }

    public static Envelope presence(String nick, String sessionId, Instant sentAt) {
        return new Envelope(EnvelopeKind.PRESENCE, nick, sessionId, PRESENCE_TOKEN, sentAt);
    }

    public static Envelope probe(String nick, String sessionId, String probeId, Instant sentAt) {
        return new Envelope(EnvelopeKind.PROBE, nick, sessionId, PROBE_PREFIX + probeId, sentAt);
    }

    public static Envelope probeReply(String nick, String sessionId, String probeId, Instant sentAt) {
        return new Envelope(EnvelopeKind.PROBE_REPLY, nick, sessionId, PROBE_REPLY_PREFIX + probeId, sentAt);
    }

    @JsonProperty("kind")
    public EnvelopeKind getKind() { return kind; }

    @JsonProperty("nick")
    public String getNick() { return nick; }

    @JsonProperty("sid")
    public String getSessionId() { return sessionId; }

    @JsonProperty("text")
    public String getText() { return text; }

    @JsonProperty("ts")
    public Instant getSentAt() { return sentAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Envelope envelope = (Envelope) o;
        return kind == envelope.kind
                && nick.equals(envelope.nick)
                && Objects.equals(sessionId, envelope.sessionId)
                && text.equals(envelope.text)
                && sentAt.equals(envelope.sentAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, nick, sessionId, text, sentAt);
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", nick='" + nick + "'" +
                (sessionId != null ? ", sid='" + sessionId + "'" : "") +
                ", text=" + (text.length() > 50 ? text.substring(0, 50) + "..." : text) +
                ", ts=" + sentAt +
                '}';
    }
}
