package com.quichat.session;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Slash commands understood by the sender loop.
 */
public enum ChatCommand {
    LIST("list"),
    PING("ping"),
    HELP("help", "h", "?"),
    QUIT("quit", "exit", "q");

    public static final String PREFIX = "/";

    private final List<String> names;

    ChatCommand(String... names) {
        this.names = List.of(names);
    }

    /**
     * @param word the text after the prefix; case and surrounding whitespace are ignored
     */
    public static Optional<ChatCommand> parse(String word) {
        String normalized = word.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.names.contains(normalized))
                .findFirst();
    }
}
