package com.quichat.p2p;

import java.io.IOException;
import java.util.Set;

/**
 * A broadcast topic shared by every peer in the room. Everything published is delivered
 * to all subscribers, the publisher included.
 */
public interface PubSubTopic extends AutoCloseable {

    /**
     * Broadcasts one datum to the topic.
     *
     * @throws TopicClosedException if the topic has been closed
     * @throws IOException          if the datum could not be sent
     */
    void publish(byte[] data) throws IOException;

    /**
     * Blocks until the next datum arrives.
     *
     * @throws TopicClosedException if the topic has been closed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    byte[] next() throws IOException, InterruptedException;

    /**
     * @return ids of the remote peers currently visible on the topic, never the local peer
     */
    Set<String> listPeers();

    @Override
    void close();
}
