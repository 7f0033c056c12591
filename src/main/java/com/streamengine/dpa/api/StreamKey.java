package com.streamengine.dpa.api;

import java.util.Objects;

/**
 * Identifies one instrument stream in the raw store:
 * subsite / node / sensor / method / stream.
 */
public record StreamKey(String subsite, String node, String sensor, String method, String stream) {

    public StreamKey {
        Objects.requireNonNull(subsite, "subsite");
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(stream, "stream");
    }

    /** Same instrument and method, different stream. */
    public StreamKey withStream(String otherStream) {
        return new StreamKey(subsite, node, sensor, method, otherStream);
    }

    @Override
    public String toString() {
        return subsite + "-" + node + "-" + sensor + "/" + method + "/" + stream;
    }
}
