package com.questrail.gridlink.protocol.lludp.observability;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a socket-level occurrence on one circuit.
 *
 * @param detail human-readable detail, e.g. why a datagram was dropped
 * @param cause  failure cause where there is one
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    InetSocketAddress remote,
    Kind kind,
    String detail,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN,
        DATAGRAM_MALFORMED,
        MESSAGE_UNRECOGNIZED
    }
}
