package com.questrail.gridlink.protocol.lludp.codec;

import com.questrail.gridlink.protocol.lludp.model.Packet;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.util.List;
import java.util.Objects;

/**
 * PacketDecodeResult
 * -----------------------------------------------------------------------------
 * Outcome of decoding one datagram.
 *
 * <ul>
 *   <li>{@link Decoded}: header, known message type and body.</li>
 *   <li>{@link Unrecognized}: the header and appended acks were readable but
 *       the message identifier is not in the table. The reliability layer
 *       still owes the peer an ack.</li>
 *   <li>{@link Malformed}: the datagram could not be framed at all.</li>
 * </ul>
 *
 * <p>None of these outcomes is fatal to a circuit.</p>
 */
public sealed interface PacketDecodeResult
        permits PacketDecodeResult.Decoded, PacketDecodeResult.Unrecognized, PacketDecodeResult.Malformed
{
    record Decoded(Packet packet) implements PacketDecodeResult
    {
        public Decoded {
            Objects.requireNonNull(packet, "packet");
        }
    }

    record Unrecognized(PacketHeader header, long wireId, List<Long> appendedAcks) implements PacketDecodeResult
    {
        public Unrecognized {
            Objects.requireNonNull(header, "header");
            appendedAcks = List.copyOf(appendedAcks);
        }

        @Override
        public String toString()
        {
            return "Unrecognized[wireId=0x" + Long.toHexString(wireId) + ", " + header + "]";
        }
    }

    record Malformed(String reason) implements PacketDecodeResult
    {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
