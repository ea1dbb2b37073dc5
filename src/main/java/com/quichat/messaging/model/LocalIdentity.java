package com.quichat.messaging.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Who this session is. The nick is for display only; the session id is what
 * distinguishes our own envelopes from those of a peer that picked the same nick.
 */
public final class LocalIdentity {

    private final String nick;
    private final String sessionId;

    public LocalIdentity(String nick, String sessionId) {
        this.nick = Objects.requireNonNull(nick, "nick cannot be null");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId cannot be null");
    }

    /**
     * Creates an identity with a fresh random session id.
     */
    public static LocalIdentity withRandomSessionId(String nick) {
        return new LocalIdentity(nick, UUID.randomUUID().toString());
    }

    public String getNick() { return nick; }
    public String getSessionId() { return sessionId; }

    @Override
    public String toString() {
        return "LocalIdentity{nick='" + nick + "', sessionId='" + sessionId + "'}";
    }
}
