package com.quichat.p2p;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One multicast datagram. {@code data} is base64 on the wire and absent on heartbeats.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record TopicFrame(String topic, String peer, Type type, byte[] data) {

    enum Type {
        DATA,
        HEARTBEAT
    }

    static TopicFrame data(String topic, String peer, byte[] data) {
        return new TopicFrame(topic, peer, Type.DATA, data);
    }

    static TopicFrame heartbeat(String topic, String peer) {
        return new TopicFrame(topic, peer, Type.HEARTBEAT, null);
    }
}
