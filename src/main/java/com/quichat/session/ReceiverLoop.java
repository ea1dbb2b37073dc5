package com.quichat.session;

import com.quichat.latency.ProbeTracker;
import com.quichat.messaging.Classification;
import com.quichat.messaging.ControlClassifier;
import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.terminal.TerminalPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Sole consumer of the topic. Decodes and classifies every datum, answers probes, resolves
 * probe replies and renders chat and presence.
 * <p>
 * Control envelopes of our own making come back to us over the topic and are dropped.
 * The loop ends when fetching from the topic fails; if the session was cancelled that is
 * a clean exit, otherwise the failure is rethrown.
 */
public class ReceiverLoop implements Callable<Void> {

    private static final Logger logger = LoggerFactory.getLogger(ReceiverLoop.class);

    private final PubSubTopic topic;
    private final EnvelopeCodec codec;
    private final ControlClassifier classifier;
    private final ProbeTracker probeTracker;
    private final TerminalPrinter printer;
    private final LocalIdentity identity;
    private final Clock clock;
    private final CancellationToken token;

    public ReceiverLoop(PubSubTopic topic, EnvelopeCodec codec, ControlClassifier classifier,
                        ProbeTracker probeTracker, TerminalPrinter printer, LocalIdentity identity,
                        Clock clock, CancellationToken token) {
        this.topic = topic;
        this.codec = codec;
        this.classifier = classifier;
        this.probeTracker = probeTracker;
        this.printer = printer;
        this.identity = identity;
        this.clock = clock;
        this.token = token;
    }

    @Override
    public Void call() throws IOException, InterruptedException {
        logger.debug("Receiver loop started.");
        while (true) {
            byte[] data;
            try {
                data = topic.next();
            } catch (InterruptedException e) {
                if (token.isCancelled()) {
                    logger.debug("Receiver loop cancelled.");
                    return null;
                }
                throw e;
            } catch (IOException e) {
                if (token.isCancelled()) {
                    logger.debug("Receiver loop stopped after cancellation: {}", e.getMessage());
                    return null;
                }
                logger.error("Fetching from topic failed: {}", e.getMessage());
                throw e;
            }
            handle(data);
        }
    }

    /**
     * Processes one datum from the topic.
     */
    void handle(byte[] data) {
        Optional<Envelope> decoded = codec.decode(data);
        if (decoded.isEmpty()) {
            return;
        }
        Classification classification = classifier.classify(decoded.get());
        Envelope envelope = classification.getEnvelope();
        logger.debug("Received {}", classification);

        if (classification.isControl() && classification.isLocal()) {
            return; // our own control echo
        }

        switch (classification.getKind()) {
            case PROBE:
                replyToProbe(classification.getPayload());
                break;
            case PROBE_REPLY:
                probeTracker.resolve(classification.getPayload(), clock.instant())
                        .ifPresent(elapsed -> printer.printLatency(envelope.getNick(), elapsed));
                break;
            case PRESENCE:
                printer.printJoined(envelope.getNick());
                break;
            case CHAT:
            default:
                printer.printChat(envelope.getNick(), classification.getPayload(), clock.instant());
                break;
        }
    }

    private void replyToProbe(String probeId) {
        Envelope reply = Envelope.probeReply(identity.getNick(), identity.getSessionId(), probeId, clock.instant());
        try {
            topic.publish(codec.encode(reply));
            logger.debug("Answered probe {}.", probeId);
        } catch (IOException e) {
            logger.warn("Failed to answer probe {}: {}", probeId, e.getMessage());
        }
    }
}
