package com.quichat.p2p;

import java.io.IOException;

/**
 * The topic was closed while, or before, it was used.
 */
public class TopicClosedException extends IOException {

    public TopicClosedException(String topic) {
        super("Topic '" + topic + "' is closed");
    }
}
