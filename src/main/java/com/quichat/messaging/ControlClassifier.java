package com.quichat.messaging;

import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.EnvelopeKind;
import com.quichat.messaging.model.LocalIdentity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides what an envelope means and whether this session produced it.
 * <p>
 * Tagged envelopes are classified by their {@code kind}; a chat message whose text happens
 * to start with a reserved prefix stays a chat message. Untagged envelopes from older peers
 * fall back to the reserved text prefixes.
 */
@Component
public class ControlClassifier {

    private final LocalIdentity identity;

    @Autowired
    public ControlClassifier(LocalIdentity identity) {
        this.identity = identity;
    }

    public Classification classify(Envelope envelope) {
        boolean local = isLocal(envelope);
        String text = envelope.getText();
        EnvelopeKind kind = envelope.getKind();

        if (kind == null) {
            return classifyUntagged(envelope, local);
        }
        switch (kind) {
            case PRESENCE:
                return new Classification(EnvelopeKind.PRESENCE, "", local, envelope);
            case PROBE:
                return new Classification(EnvelopeKind.PROBE, stripPrefix(text, Envelope.PROBE_PREFIX), local, envelope);
            case PROBE_REPLY:
                return new Classification(EnvelopeKind.PROBE_REPLY, stripPrefix(text, Envelope.PROBE_REPLY_PREFIX), local, envelope);
            case CHAT:
            default:
                return new Classification(EnvelopeKind.CHAT, text, local, envelope);
        }
    }

    /**
     * An envelope is ours when it carries our session id. Envelopes without a session id
     * can only be matched by nick.
     */
    public boolean isLocal(Envelope envelope) {
        if (envelope.getSessionId() != null) {
            return envelope.getSessionId().equals(identity.getSessionId());
        }
        return envelope.getNick().equals(identity.getNick());
    }

    private Classification classifyUntagged(Envelope envelope, boolean local) {
        String text = envelope.getText();
        if (text.equals(Envelope.PRESENCE_TOKEN)) {
            return new Classification(EnvelopeKind.PRESENCE, "", local, envelope);
        }
        if (text.startsWith(Envelope.PROBE_PREFIX)) {
            return new Classification(EnvelopeKind.PROBE, text.substring(Envelope.PROBE_PREFIX.length()), local, envelope);
        }
        if (text.startsWith(Envelope.PROBE_REPLY_PREFIX)) {
            return new Classification(EnvelopeKind.PROBE_REPLY, text.substring(Envelope.PROBE_REPLY_PREFIX.length()), local, envelope);
        }
        return new Classification(EnvelopeKind.CHAT, text, local, envelope);
    }

    private static String stripPrefix(String text, String prefix) {
        return text.startsWith(prefix) ? text.substring(prefix.length()) : text;
    }
}
