package com.quichat.terminal;

import java.io.IOException;

/**
 * Failure reading from the terminal.
 */
public class TerminalException extends IOException {

    public TerminalException(String message) {
        super(message);
    }

    public TerminalException(String message, Throwable cause) {
        super(message, cause);
    }
}
