package com.quichat.messaging;

/**
 * Raised when an {@link com.quichat.messaging.model.Envelope} cannot be written to its wire form.
 */
public class EnvelopeCodecException extends RuntimeException {

    public EnvelopeCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
