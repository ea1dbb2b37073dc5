package com.quichat.session;

/**
 * A session ended because one of its tasks failed. Never raised for {@code /quit}
 * or external cancellation.
 */
public class SessionException extends Exception {

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
