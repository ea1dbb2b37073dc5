package com.quichat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Chat session and topic settings, bound from {@code quichat.*}.
 */
@ConfigurationProperties(prefix = "quichat")
public record ChatProperties(
        /** Display name shown to other peers. Default: "anon". */
        String nick,

        /** Logical topic; frames for any other topic are ignored. */
        String topic,

        /** LAN multicast group that carries the topic. */
        String multicastGroup,

        /** UDP port of the topic. */
        Integer port,

        /** Datagram TTL. 1 keeps traffic on the local segment. */
        Integer multicastTtl,

        /** How often this peer advertises itself while idle. */
        Duration heartbeatInterval,

        /** Peers not heard from within this window drop out of the peer list. */
        Duration peerTimeout,

        /** Polling interval of the presence announcer. */
        Duration presencePollInterval,

        /** Unanswered probes older than this are discarded. Zero keeps them forever. */
        Duration probeTtl,

        /** How long to wait for session tasks to exit once the session is cancelled. */
        Duration shutdownTimeout,

        /** With no peer in sight for this long the session counts as active without announcing. */
        Duration presenceTimeout
) {

    public ChatProperties {
        if (nick == null) nick = "anon";
        if (topic == null || topic.isBlank()) topic = "peerchat:global";
        if (multicastGroup == null || multicastGroup.isBlank()) multicastGroup = "230.0.0.1";
        if (port == null) port = 4001;
        if (multicastTtl == null) multicastTtl = 1;
        if (heartbeatInterval == null) heartbeatInterval = Duration.ofSeconds(2);
        if (peerTimeout == null) peerTimeout = Duration.ofSeconds(10);
        if (presencePollInterval == null) presencePollInterval = Duration.ofMillis(250);
        if (probeTtl == null) probeTtl = Duration.ofMinutes(5);
        if (shutdownTimeout == null) shutdownTimeout = Duration.ofSeconds(5);
        if (presenceTimeout == null) presenceTimeout = Duration.ofSeconds(10);

        if (nick.isBlank()) {
            throw new IllegalArgumentException("quichat.nick must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("quichat.port must be between 1 and 65535, was " + port);
        }
        if (multicastTtl < 0 || multicastTtl > 255) {
            throw new IllegalArgumentException("quichat.multicast-ttl must be between 0 and 255, was " + multicastTtl);
        }
        requirePositive("quichat.heartbeat-interval", heartbeatInterval);
        requirePositive("quichat.peer-timeout", peerTimeout);
        requirePositive("quichat.presence-poll-interval", presencePollInterval);
        requirePositive("quichat.shutdown-timeout", shutdownTimeout);
        requirePositive("quichat.presence-timeout", presenceTimeout);
    }

    /** Settings with every default applied. */
    public static ChatProperties defaults() {
        return new ChatProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    private static void requirePositive(String key, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be positive, was " + value);
        }
    }
}
