package com.quichat.terminal;

/**
 * The user interrupted the line being typed. The session re-prompts and carries on.
 */
public class UserInterruptException extends TerminalException {

    public UserInterruptException() {
        super("Input interrupted");
    }
}
