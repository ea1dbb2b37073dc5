package com.quichat.p2p;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quichat.config.ChatProperties;
import com.quichat.messaging.model.LocalIdentity;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.SocketException;
import java.net.StandardSocketOptions;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link PubSubTopic} carried over LAN UDP multicast.
 * <p>
 * Every datagram is a JSON {@link TopicFrame}. Data frames are queued for {@link #next()};
 * every frame from a remote peer refreshes that peer's last-seen time, and a periodic
 * heartbeat keeps idle peers visible. Our own publishes are queued locally, and our own
 * frames coming back over multicast loopback are dropped.
 */
@Service
public class MulticastPubSubTopic implements PubSubTopic {

    private static final Logger logger = LoggerFactory.getLogger(MulticastPubSubTopic.class);
    private static final int MAX_DATAGRAM_BYTES = 65507;
    private static final byte[] CLOSED_MARKER = new byte[0];

    private final String topic;
    private final String localPeerId;
    private final String groupAddress;
    private final int port;
    private final int ttl;
    private final Duration heartbeatInterval;
    private final Duration peerTimeout;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final LinkedBlockingQueue<byte[]> inbox = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, Long> lastSeen = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private MulticastSocket socket;
    private InetSocketAddress group;
    private Thread listenerThread;
    private ScheduledExecutorService heartbeatScheduler;

    @Autowired
    public MulticastPubSubTopic(ChatProperties properties, LocalIdentity identity) {
        this(properties, identity.getSessionId(), Clock.systemUTC());
    }

    MulticastPubSubTopic(ChatProperties properties, String localPeerId, Clock clock) {
        this.topic = properties.topic();
        this.localPeerId = localPeerId;
        this.groupAddress = properties.multicastGroup();
        this.port = properties.port();
        this.ttl = properties.multicastTtl();
        this.heartbeatInterval = properties.heartbeatInterval();
        this.peerTimeout = properties.peerTimeout();
        this.clock = clock;
    }

    /**
     * Joins the multicast group and starts the listener and heartbeat.
     */
    @PostConstruct
    public synchronized void start() {
        if (socket != null) {
            logger.info("Topic '{}' already started.", topic);
            return;
        }
        try {
            group = new InetSocketAddress(InetAddress.getByName(groupAddress), port);
            socket = new MulticastSocket(port);
            socket.setReuseAddress(true);
            socket.setOption(StandardSocketOptions.IP_MULTICAST_TTL, ttl);
            // Loopback on: other instances on this host are peers too.
            socket.setOption(StandardSocketOptions.IP_MULTICAST_LOOP, true);
            socket.joinGroup(group, null);
        } catch (IOException e) {
            if (socket != null) {
                socket.close();
                socket = null;
            }
            throw new UncheckedIOException("Failed to join multicast group " + groupAddress + ":" + port, e);
        }
        logger.info("Joined topic '{}' on {}:{} as peer {}.", topic, groupAddress, port, localPeerId);

        listenerThread = new Thread(this::listen, "Topic-Listener-" + topic);
        listenerThread.setDaemon(true);
        listenerThread.start();

        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Topic-Heartbeat-" + topic);
            t.setDaemon(true);
            return t;
        });
        long periodMs = heartbeatInterval.toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeat, 0, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void publish(byte[] data) throws IOException {
        if (closed.get()) {
            throw new TopicClosedException(topic);
        }
        send(TopicFrame.data(topic, localPeerId, data));
        inbox.offer(data);
    }

    @Override
    public byte[] next() throws IOException, InterruptedException {
        byte[] data = inbox.take();
        if (data == CLOSED_MARKER) {
            inbox.offer(CLOSED_MARKER); // wake any other waiter too
            throw new TopicClosedException(topic);
        }
        return data;
    }

    @Override
    public Set<String> listPeers() {
        long cutoff = clock.millis() - peerTimeout.toMillis();
        lastSeen.entrySet().removeIf(entry -> {
            if (entry.getValue() < cutoff) {
                logger.info("Peer {} timed out on topic '{}'.", entry.getKey(), topic);
                return true;
            }
            return false;
        });
        return new TreeSet<>(lastSeen.keySet());
    }

    @PreDestroy
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing topic '{}'.", topic);
        if (heartbeatScheduler != null) {
            heartbeatScheduler.shutdownNow();
        }
        synchronized (this) {
            if (socket != null && !socket.isClosed()) {
                try {
                    socket.leaveGroup(group, null);
                } catch (IOException e) {
                    logger.warn("Error leaving multicast group {}:{}: {}", groupAddress, port, e.getMessage());
                } finally {
                    socket.close();
                }
            }
        }
        if (listenerThread != null) {
            listenerThread.interrupt();
        }
        lastSeen.clear();
        inbox.offer(CLOSED_MARKER);
    }

    /**
     * Handles one received datagram payload.
     */
    void onDatagram(byte[] payload) {
        TopicFrame frame;
        try {
            frame = objectMapper.readValue(payload, TopicFrame.class);
        } catch (IOException e) {
            logger.debug("Ignoring non-frame datagram ({} bytes): {}", payload.length, e.getMessage());
            return;
        }
        if (frame == null || frame.peer() == null || frame.type() == null || !topic.equals(frame.topic())) {
            return;
        }
        if (frame.peer().equals(localPeerId)) {
            return; // our own publish, already queued locally
        }
        Long previous = lastSeen.put(frame.peer(), clock.millis());
        if (previous == null) {
            logger.info("Peer {} seen on topic '{}'.", frame.peer(), topic);
        }
        if (frame.type() == TopicFrame.Type.DATA && frame.data() != null) {
            inbox.offer(frame.data());
        }
    }

    private void listen() {
        byte[] buffer = new byte[MAX_DATAGRAM_BYTES];
        DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
        while (!closed.get() && !Thread.currentThread().isInterrupted()) {
            try {
                packet.setLength(buffer.length);
                socket.receive(packet);
                onDatagram(Arrays.copyOfRange(packet.getData(), packet.getOffset(), packet.getOffset() + packet.getLength()));
            } catch (SocketException se) {
                if (closed.get() || socket.isClosed()) {
                    break;
                }
                logger.warn("SocketException on topic '{}': {}", topic, se.getMessage());
            } catch (IOException e) {
                if (closed.get()) {
                    break;
                }
                logger.warn("IOException receiving on topic '{}': {}", topic, e.getMessage());
            }
        }
        logger.debug("Listener for topic '{}' stopped.", topic);
    }

    private void sendHeartbeat() {
        if (closed.get()) {
            return;
        }
        try {
            send(TopicFrame.heartbeat(topic, localPeerId));
        } catch (IOException e) {
            logger.warn("Heartbeat on topic '{}' failed: {}", topic, e.getMessage());
        } catch (RuntimeException e) {
            // must not escape, or the schedule stops
            logger.error("Unexpected error sending heartbeat on topic '{}'", topic, e);
        }
    }

    private void send(TopicFrame frame) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(frame);
        if (bytes.length > MAX_DATAGRAM_BYTES) {
            throw new IOException("Frame of " + bytes.length + " bytes exceeds the datagram limit");
        }
        MulticastSocket current = socket;
        if (current == null || current.isClosed()) {
            throw new TopicClosedException(topic);
        }
        current.send(new DatagramPacket(bytes, bytes.length, group));
    }
}
