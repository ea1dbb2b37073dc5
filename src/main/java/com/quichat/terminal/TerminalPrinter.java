package com.quichat.terminal;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;

/**
 * Renders everything the session shows on the terminal.
 * <p>
 * The receiver and the sender print from different threads. Every block goes above the input
 * line in one call while holding this printer's monitor, so blocks never interleave.
 */
@Component
public class TerminalPrinter {

    static final String ERASE_PREVIOUS_LINE = "\u001b[1A\u001b[2K\r";
    static final String GREEN = "\u001b[32m";
    static final String BOLD_GREEN = "\u001b[1;32m";
    static final String CYAN = "\u001b[36m";
    static final String RESET = "\u001b[0m";

    static final String HELP_TEXT = String.join("\n",
            "Available commands:",
            "/help, /h, /?   Show this help",
            "/quit, /exit    Leave the chat",
            "/list           Show peers currently in the room",
            "/ping           Measure round-trip latency to all peers");

    private static final String BANNER = String.join("\n",
            "",
            "   ___        _      _           _   ",
            "  / _ \\ _   _(_) ___| |__   __ _| |_ ",
            " | | | | | | | |/ __| '_ \\ / _` | __|",
            " | |_| | |_| | | (__| | | | (_| | |_ ",
            "  \\__\\_\\\\__,_|_|\\___|_| |_|\\__,_|\\__|",
            "");

    private static final DateTimeFormatter DELIVERY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Terminal terminal;
    private final ZoneId zone;

    @Autowired
    public TerminalPrinter(Terminal terminal) {
        this(terminal, ZoneId.systemDefault());
    }

    public TerminalPrinter(Terminal terminal, ZoneId zone) {
        this.terminal = terminal;
        this.zone = zone;
    }

    public synchronized void printWelcome(String topic) {
        terminal.printAbove(BANNER + "\nWelcome to Quichat! Room: " + topic + "\nType /help for commands.\n");
    }

    /**
     * A chat line, timestamped with the local delivery time. Embedded newlines are continued
     * with the message marker.
     */
    public synchronized void printChat(String nick, String text, Instant deliveredAt) {
        String body = text.replace("\n", "\n» ");
        terminal.printAbove("> [" + DELIVERY_FORMAT.format(deliveredAt.atZone(zone)) + "] [" + GREEN + nick + RESET + "]\n"
                + "» " + body + "\n\n");
    }

    public synchronized void printJoined(String nick) {
        terminal.printAbove(BOLD_GREEN + "*** " + nick + " joined the chat ***" + RESET);
    }

    public synchronized void printLatency(String nick, Duration elapsed) {
        terminal.printAbove(CYAN + "Pong from " + nick + ": " + elapsed.toMillis() + " ms" + RESET);
    }

    public synchronized void printPeers(Collection<String> peers) {
        terminal.printAbove("Peers (" + peers.size() + "): " + peers);
    }

    public synchronized void printHelp() {
        terminal.printAbove(HELP_TEXT);
    }

    public synchronized void printUnknownCommand(String command) {
        terminal.printAbove("Unknown command: " + command);
    }

    public synchronized void printNotice(String notice) {
        terminal.printAbove(notice);
    }

    public synchronized void printFarewell() {
        terminal.printAbove("👋  Bye!");
    }

    /**
     * Removes the line the user just submitted; the message is shown again once the topic
     * delivers it back.
     */
    public synchronized void eraseSubmittedLine() {
        terminal.write(ERASE_PREVIOUS_LINE);
    }
}
