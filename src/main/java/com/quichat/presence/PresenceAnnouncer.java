package com.quichat.presence;

import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.session.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Announces this session to the room once somebody is there to hear it.
 * <p>
 * Polls {@link PubSubTopic#listPeers()} every {@code pollInterval} until the peer set is
 * non-empty, publishes a single presence envelope and stops. If the session is cancelled
 * first, nothing is published. The publish is latched: however many times
 * {@link #announceOnce()} is called, and from however many threads, at most one presence
 * envelope goes out.
 * <p>
 * {@code onActive} runs once, either right after the announcement or when no peer has shown
 * up within {@code activeTimeout}. Polling carries on after the timeout.
 */
public class PresenceAnnouncer implements Callable<Void> {

    private static final Logger logger = LoggerFactory.getLogger(PresenceAnnouncer.class);

    private final PubSubTopic topic;
    private final EnvelopeCodec codec;
    private final LocalIdentity identity;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration activeTimeout;
    private final CancellationToken token;
    private final Runnable onActive;
    private final AtomicBoolean announced = new AtomicBoolean(false);
    private final AtomicBoolean active = new AtomicBoolean(false);

    public PresenceAnnouncer(PubSubTopic topic, EnvelopeCodec codec, LocalIdentity identity, Clock clock,
                             Duration pollInterval, Duration activeTimeout, CancellationToken token,
                             Runnable onActive) {
        this.topic = topic;
        this.codec = codec;
        this.identity = identity;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.activeTimeout = activeTimeout;
        this.token = token;
        this.onActive = onActive;
    }

    @Override
    public Void call() {
        logger.debug("Presence announcer waiting for peers (poll every {}).", pollInterval);
        Duration waited = Duration.ZERO;
        try {
            while (!token.isCancelled()) {
                if (!topic.listPeers().isEmpty()) {
                    announceOnce();
                    return null;
                }
                if (!active.get() && waited.compareTo(activeTimeout) >= 0) {
                    logger.info("No peers seen within {}; still waiting to announce.", activeTimeout);
                    markActive();
                }
                if (token.await(pollInterval)) {
                    break;
                }
                waited = waited.plus(pollInterval);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Session cancelled before any peer was seen; presence not announced.");
        return null;
    }

    /**
     * Publishes the presence envelope unless it has already been published.
     *
     * @return true if this call published it
     */
    public boolean announceOnce() {
        if (!announced.compareAndSet(false, true)) {
            return false;
        }
        Envelope presence = Envelope.presence(identity.getNick(), identity.getSessionId(), clock.instant());
        try {
            topic.publish(codec.encode(presence));
            logger.info("Announced presence of '{}' to the room.", identity.getNick());
        } catch (IOException e) {
            // latch stays set: presence is attempted once per session
            logger.warn("Failed to publish presence announcement: {}", e.getMessage());
        }
        markActive();
        return true;
    }

    public boolean hasAnnounced() {
        return announced.get();
    }

    private void markActive() {
        if (active.compareAndSet(false, true)) {
            onActive.run();
        }
    }
}
