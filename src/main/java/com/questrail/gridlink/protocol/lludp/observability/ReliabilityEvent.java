package com.questrail.gridlink.protocol.lludp.observability;

import com.questrail.gridlink.protocol.lludp.model.MessageType;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a reliability-layer occurrence on one circuit.
 *
 * @param type  message type involved; {@code null} for {@link Kind#ACKS_FLUSHED}
 * @param count retry count for resends and failures, ack count for flushes
 */
public record ReliabilityEvent(
    Instant timestamp,
    InetSocketAddress remote,
    Kind kind,
    long sequence,
    MessageType type,
    int count
) {
    public enum Kind {
        RESENT,
        DELIVERY_FAILED,
        DUPLICATE_RECEIVED,
        ACKS_FLUSHED
    }
}
