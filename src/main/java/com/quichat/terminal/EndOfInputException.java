package com.quichat.terminal;

/**
 * The terminal's input stream has ended.
 */
public class EndOfInputException extends TerminalException {

    public EndOfInputException() {
        super("End of input");
    }
}
