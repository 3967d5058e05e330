package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PacketAck
 * -----------------------------------------------------------------------------
 * Acknowledgement-only message: a U8 count followed by that many U32
 * sequence numbers. Consumed by the circuit; never handed to application
 * handlers.
 */
public record PacketAck(List<Long> sequences)
{
    public static final int MAX_PER_PACKET = 0xFF;

    public PacketAck {
        sequences = List.copyOf(Objects.requireNonNull(sequences, "sequences"));
        if (sequences.size() > MAX_PER_PACKET) {
            throw new IllegalArgumentException("At most 255 acks per packet, got " + sequences.size());
        }
    }

    public byte[] toBody()
    {
        BodyWriter w = new BodyWriter().writeU8(sequences.size());
        for (Long seq : sequences) {
            w.writeU32(seq);
        }
        return w.toByteArray();
    }

    public static PacketAck fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        int count = r.readU8();
        List<Long> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(r.readU32());
        }
        return new PacketAck(out);
    }
}
