package com.quichat.terminal;

import java.io.IOException;

/**
 * Line-oriented interactive terminal.
 */
public interface Terminal extends AutoCloseable {

    String DEFAULT_PROMPT = "> ";

    /**
     * Shows the prompt and blocks until the user enters a line.
     *
     * @return the line, without its terminator
     * @throws UserInterruptException if the user interrupted the current input
     * @throws EndOfInputException    if the input stream has ended
     * @throws TerminalException      on any other device error
     * @throws InterruptedException   if the reading thread is interrupted
     */
    String readLine() throws IOException, InterruptedException;

    /**
     * Prints a block above the input line. The prompt and anything the user has typed so far
     * are redrawn underneath it. A missing trailing newline is added.
     */
    void printAbove(String text);

    /**
     * Writes raw text, escape sequences included, and flushes it.
     */
    void write(String text);

    default String prompt() {
        return DEFAULT_PROMPT;
    }

    @Override
    void close();
}
