package com.questrail.gridlink.protocol.lludp.internal.reliability;

import com.questrail.gridlink.protocol.lludp.model.MessageType;

import java.util.Objects;

/**
 * One unacknowledged reliable packet.
 *
 * <p>{@code bytes} are the datagram as first encoded, without appended acks
 * and without the resent flag. The array is copied on the way in and out, so
 * a caller reusing its encode buffer cannot alter what is resent.
 * {@code retries} counts resends so far.</p>
 */
public record OutboundPending(
        long sequence,
        MessageType type,
        byte[] bytes,
        long sentAtNanos,
        int retries
) {
    public OutboundPending {
        Objects.requireNonNull(type, "type");
        bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    OutboundPending resentAt(long nowNanos)
    {
        return new OutboundPending(sequence, type, bytes, nowNanos, retries + 1);
    }

    @Override
    public byte[] bytes()
    {
        return bytes.clone();
    }

    @Override
    public String toString()
    {
        return "OutboundPending[seq=" + sequence + ", " + type + ", retries=" + retries + "]";
    }
}
