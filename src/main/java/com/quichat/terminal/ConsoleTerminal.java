package com.quichat.terminal;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOError;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link Terminal} backed by a JLine {@link LineReader}.
 * <p>
 * Ctrl+C while a line is being read surfaces as {@link UserInterruptException}, Ctrl+D on an
 * empty line as {@link EndOfInputException}. Blocks printed from other threads go through
 * {@link LineReader#printAbove(String)}, which keeps the prompt and the half-typed line intact.
 */
public class ConsoleTerminal implements Terminal {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleTerminal.class);

    private final org.jline.terminal.Terminal terminal;
    private final LineReader reader;
    private volatile boolean closed = false;

    public ConsoleTerminal(org.jline.terminal.Terminal terminal) {
        this.terminal = terminal;
        this.reader = LineReaderBuilder.builder()
                .appName("quichat")
                .terminal(terminal)
                .build();
    }

    /**
     * Opens the process console.
     */
    public static ConsoleTerminal system() throws IOException {
        org.jline.terminal.Terminal terminal = TerminalBuilder.builder()
                .name("quichat")
                .system(true)
                .encoding(StandardCharsets.UTF_8)
                .build();
        logger.info("Opened {} terminal of type '{}'.", terminal.getName(), terminal.getType());
        return new ConsoleTerminal(terminal);
    }

    @Override
    public String readLine() throws IOException, InterruptedException {
        if (closed) {
            throw new EndOfInputException();
        }
        try {
            return reader.readLine(prompt());
        } catch (org.jline.reader.UserInterruptException e) {
            throw new UserInterruptException();
        } catch (EndOfFileException e) {
            throw new EndOfInputException();
        } catch (IOError e) {
            if (closed) {
                throw new EndOfInputException();
            }
            throw new TerminalException("Failed to read from terminal", e.getCause());
        }
    }

    @Override
    public void printAbove(String text) {
        reader.printAbove(text);
    }

    @Override
    public void write(String text) {
        terminal.writer().print(text);
        terminal.flush();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            terminal.close();
            logger.debug("Console terminal closed.");
        } catch (IOException e) {
            logger.warn("Error closing terminal: {}", e.getMessage());
        }
    }

    // visible for tests
    boolean isReading() {
        return reader.isReading();
    }
}
