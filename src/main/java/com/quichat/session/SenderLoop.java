package com.quichat.session;

import com.quichat.latency.ProbeTracker;
import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.terminal.Terminal;
import com.quichat.terminal.TerminalPrinter;
import com.quichat.terminal.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Reads terminal lines, runs slash commands and publishes everything else as chat.
 * <p>
 * An interrupted line is re-prompted. {@code /quit} cancels the session and ends the loop
 * normally. End of input and a failed chat publish end the loop with an exception.
 */
public class SenderLoop implements Callable<Void> {

    private static final Logger logger = LoggerFactory.getLogger(SenderLoop.class);

    private final Terminal terminal;
    private final TerminalPrinter printer;
    private final PubSubTopic topic;
    private final EnvelopeCodec codec;
    private final ProbeTracker probeTracker;
    private final LocalIdentity identity;
    private final Clock clock;
    private final CancellationToken token;

    public SenderLoop(Terminal terminal, TerminalPrinter printer, PubSubTopic topic, EnvelopeCodec codec,
                      ProbeTracker probeTracker, LocalIdentity identity, Clock clock, CancellationToken token) {
        this.terminal = terminal;
        this.printer = printer;
        this.topic = topic;
        this.codec = codec;
        this.probeTracker = probeTracker;
        this.identity = identity;
        this.clock = clock;
        this.token = token;
    }

    @Override
    public Void call() throws IOException, InterruptedException {
        logger.debug("Sender loop started.");
        while (!token.isCancelled()) {
            String line;
            try {
                line = terminal.readLine();
            } catch (UserInterruptException e) {
                logger.debug("Input interrupted; prompting again.");
                continue;
            } catch (InterruptedException e) {
                if (token.isCancelled()) {
                    return null;
                }
                throw e;
            } catch (IOException e) {
                if (token.isCancelled()) {
                    return null;
                }
                logger.info("Terminal input ended: {}", e.getMessage());
                throw e;
            }
            if (!handleLine(line)) {
                return null;
            }
        }
        return null;
    }

    /**
     * Handles one line of input.
     *
     * @return false once the user has asked to quit
     * @throws IOException if a chat message could not be published
     */
    boolean handleLine(String line) throws IOException {
        if (line.startsWith(ChatCommand.PREFIX)) {
            String word = line.substring(ChatCommand.PREFIX.length()).trim().toLowerCase(Locale.ROOT);
            Optional<ChatCommand> command = ChatCommand.parse(word);
            if (command.isEmpty()) {
                printer.printUnknownCommand(word);
                return true;
            }
            return runCommand(command.get());
        }

        printer.eraseSubmittedLine();
        Envelope chat = Envelope.chat(identity.getNick(), identity.getSessionId(), line, clock.instant());
        topic.publish(codec.encode(chat));
        return true;
    }

    private boolean runCommand(ChatCommand command) {
        switch (command) {
            case LIST:
                printer.printPeers(topic.listPeers());
                return true;
            case PING:
                sendProbe();
                return true;
            case HELP:
                printer.printHelp();
                return true;
            case QUIT:
            default:
                logger.info("User requested to leave the chat.");
                printer.printFarewell();
                token.cancel();
                return false;
        }
    }

    private void sendProbe() {
        String probeId = probeTracker.newProbeId();
        Instant now = clock.instant();
        probeTracker.record(probeId, now);
        try {
            topic.publish(codec.encode(Envelope.probe(identity.getNick(), identity.getSessionId(), probeId, now)));
            logger.debug("Sent probe {}.", probeId);
        } catch (IOException e) {
            probeTracker.forget(probeId);
            logger.warn("Failed to publish probe {}: {}", probeId, e.getMessage());
            printer.printNotice("Ping failed: " + e.getMessage());
        }
    }
}
