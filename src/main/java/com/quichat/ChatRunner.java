package com.quichat;

import com.quichat.config.ChatProperties;
import com.quichat.latency.ProbeTracker;
import com.quichat.messaging.ControlClassifier;
import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.session.ChatSession;
import com.quichat.session.SessionException;
import com.quichat.terminal.Terminal;
import com.quichat.terminal.TerminalPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Runs one chat session on startup and reports how it ended as the process exit code.
 * Ctrl+C at the prompt only discards the line being typed. SIGTERM, or a SIGINT that arrives
 * while no line is being read, cancels the session through a JVM shutdown hook.
 */
@Component
public class ChatRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ChatRunner.class);

    private final ChatProperties properties;
    private final LocalIdentity identity;
    private final PubSubTopic topic;
    private final Terminal terminal;
    private final TerminalPrinter printer;
    private final EnvelopeCodec codec;
    private final ControlClassifier classifier;
    private final ProbeTracker probeTracker;
    private final Clock clock;
    private volatile int exitCode = 0;

    @Autowired
    public ChatRunner(ChatProperties properties, LocalIdentity identity, PubSubTopic topic, Terminal terminal,
                      TerminalPrinter printer, EnvelopeCodec codec, ControlClassifier classifier,
                      ProbeTracker probeTracker, Clock clock) {
        this.properties = properties;
        this.identity = identity;
        this.topic = topic;
        this.terminal = terminal;
        this.printer = printer;
        this.codec = codec;
        this.classifier = classifier;
        this.probeTracker = probeTracker;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        ChatSession session = new ChatSession(identity, topic, terminal, printer, codec, classifier, probeTracker,
                clock, properties.presencePollInterval(), properties.presenceTimeout(), properties.shutdownTimeout());

        Thread shutdownHook = new Thread(() -> {
            session.cancel();
            try {
                session.awaitTermination(properties.shutdownTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "ChatSession-ShutdownHook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        printer.printWelcome(properties.topic());
        try {
            session.run();
        } catch (SessionException e) {
            exitCode = 1;
            terminal.write("\nSession ended: " + e.getMessage() + "\n");
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down; shutdown hook left in place.");
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
