package com.quichat.session;

/**
 * Lifecycle of a {@link ChatSession}. Both loops run from {@code ANNOUNCING} on;
 * {@code ACTIVE} marks that the presence announcement has gone out, or that the presence
 * timeout passed without any peer.
 */
public enum SessionState {
    IDLE,
    ANNOUNCING,
    ACTIVE,
    CLOSING,
    TERMINATED
}
