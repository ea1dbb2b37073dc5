package com.quichat.latency;

import com.quichat.config.ChatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outstanding latency probes, keyed by probe id.
 * The sender records a probe when it publishes one; the receiver resolves it when the
 * matching reply comes back. Both run on different threads, so every operation here is
 * safe for concurrent use and a reply is consumed at most once.
 */
@Component
public class ProbeTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProbeTracker.class);
    private static final int PROBE_ID_BYTES = 8;

    private final SecureRandom random = new SecureRandom();
    private final ConcurrentHashMap<String, Instant> outstanding = new ConcurrentHashMap<>();
    private final Duration ttl;

    @Autowired
    public ProbeTracker(ChatProperties properties) {
        this(properties.probeTtl());
    }

    /**
     * @param ttl how long an unanswered probe is kept; zero or negative keeps it forever.
     */
    public ProbeTracker(Duration ttl) {
        this.ttl = ttl;
    }

    /**
     * @return a fresh opaque probe id, 16 lower-case hex characters.
     */
    public String newProbeId() {
        byte[] bytes = new byte[PROBE_ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Records a probe as sent at the given time. Expired probes are swept first.
     */
    public void record(String probeId, Instant sentAt) {
        sweepExpired(sentAt);
        outstanding.put(probeId, sentAt);
        logger.debug("Recorded probe {} at {}. Outstanding: {}", probeId, sentAt, outstanding.size());
    }

    /**
     * Looks up and removes a probe.
     *
     * @param probeId    the id echoed back by a peer
     * @param receivedAt when the reply arrived
     * @return the round-trip time, or empty if the id is unknown or was already resolved
     */
    public Optional<Duration> resolve(String probeId, Instant receivedAt) {
        Instant sentAt = outstanding.remove(probeId);
        if (sentAt == null) {
            logger.debug("No outstanding probe for id {}.", probeId);
            return Optional.empty();
        }
        Duration elapsed = Duration.between(sentAt, receivedAt);
        return Optional.of(elapsed.isNegative() ? Duration.ZERO : elapsed);
    }

    /**
     * Drops a probe that will never be answered, e.g. because publishing it failed.
     */
    public boolean forget(String probeId) {
        return outstanding.remove(probeId) != null;
    }

    /**
     * Removes probes older than the configured ttl.
     *
     * @return the number of probes removed
     */
    public int sweepExpired(Instant now) {
        if (ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        Instant cutoff = now.minus(ttl);
        int removed = 0;
        for (Map.Entry<String, Instant> entry : outstanding.entrySet()) {
            if (entry.getValue().isBefore(cutoff) && outstanding.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Expired {} unanswered probe(s) older than {}.", removed, ttl);
        }
        return removed;
    }

    public boolean isOutstanding(String probeId) {
        return outstanding.containsKey(probeId);
    }

    public int outstandingCount() {
        return outstanding.size();
    }
}
