package com.questrail.gridlink.protocol.lludp.circuit;

import com.questrail.gridlink.protocol.lludp.codec.PacketDecoder;
import com.questrail.gridlink.protocol.lludp.codec.PacketEncoder;
import com.questrail.gridlink.protocol.lludp.internal.time.MonotonicClock;
import com.questrail.gridlink.protocol.lludp.internal.time.MonotonicScheduler;
import com.questrail.gridlink.protocol.lludp.internal.time.WallClock;
import com.questrail.gridlink.protocol.lludp.observability.LludpObservabilitySink;
import com.questrail.gridlink.protocol.lludp.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every circuit of one network manager.
 *
 * @param loop          event loop that transport callbacks are handed to
 * @param maxPacketSize largest datagram a circuit will send, in bytes
 * @param sink          observability sink; {@code null} means no observability
 */
public record CircuitEnvironment(
        PacketDecoder decoder,
        PacketEncoder encoder,
        CircuitTimingPolicy timing,
        int maxPacketSize,
        MonotonicClock clock,
        MonotonicScheduler scheduler,
        Executor loop,
        WallClock wallClock,
        LludpObservabilitySink sink
) {
    /** Smallest datagram able to carry a header, an identifier and a PacketAck. */
    public static final int MIN_PACKET_SIZE = 64;

    public CircuitEnvironment {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(loop, "loop");
        Objects.requireNonNull(wallClock, "wallClock");
        sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        if (maxPacketSize < MIN_PACKET_SIZE) {
            throw new IllegalArgumentException("maxPacketSize must be at least " + MIN_PACKET_SIZE);
        }
    }
}
