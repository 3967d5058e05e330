package com.questrail.gridlink.protocol.lludp.observability;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * An error raised outside the codec, typically by application code running on
 * the event loop (a packet handler or network event listener).
 *
 * @param remote region the error relates to, or {@code null} when it is not
 *               tied to one circuit
 */
public record LludpErrorEvent(
    Instant timestamp,
    InetSocketAddress remote,
    String message,
    Throwable cause
) {
    public LludpErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(message, "message");
    }
}
