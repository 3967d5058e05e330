package com.questrail.gridlink.protocol.lludp.codec.impl;

import com.questrail.gridlink.protocol.lludp.codec.PacketEncoder;
import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.util.List;
import java.util.Objects;

/**
 * DefaultPacketEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PacketEncoder}.
 *
 * <p>Zero-coding covers the message identifier and body. The header and any
 * appended acks are always written plain.</p>
 */
public final class DefaultPacketEncoder implements PacketEncoder
{
    @Override
    public byte[] encode(PacketHeader header, MessageType type, byte[] body)
    {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(body, "body");

        byte[] id = type.wireBytes();
        byte[] payload = new byte[id.length + body.length];
        System.arraycopy(id, 0, payload, 0, id.length);
        System.arraycopy(body, 0, payload, id.length, body.length);

        // Acks are appended separately; a freshly encoded datagram never claims them.
        PacketHeader effective = header.withHasAcks(false);
        if (header.zeroCoded()) {
            byte[] coded = ZeroCoding.encode(payload);
            if (coded.length < payload.length) {
                payload = coded;
            }
            else {
                effective = effective.withZeroCoded(false);
            }
        }

        byte[] head = PacketHeaderCodec.encode(effective);
        byte[] out = new byte[head.length + payload.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(payload, 0, out, head.length, payload.length);
        return out;
    }

    @Override
    public byte[] appendAcks(byte[] datagram, List<Long> acks)
    {
        Objects.requireNonNull(datagram, "datagram");
        Objects.requireNonNull(acks, "acks");
        if (datagram.length < PacketFraming.HEADER_LENGTH) {
            throw new IllegalArgumentException("Not a datagram: " + datagram.length + " bytes");
        }
        if (acks.isEmpty()) {
            return datagram.clone();
        }
        if (acks.size() > PacketFraming.MAX_APPENDED_ACKS) {
            throw new IllegalArgumentException("At most 255 appended acks, got " + acks.size());
        }
        if ((datagram[0] & PacketFraming.FLAG_APPENDED_ACKS) != 0) {
            throw new IllegalArgumentException("Datagram already carries appended acks");
        }

        byte[] out = new byte[datagram.length + acks.size() * PacketFraming.ACK_LENGTH + 1];
        System.arraycopy(datagram, 0, out, 0, datagram.length);
        int p = datagram.length;
        for (Long ack : acks) {
            long seq = ack;
            out[p++] = (byte) (seq >>> 24);
            out[p++] = (byte) (seq >>> 16);
            out[p++] = (byte) (seq >>> 8);
            out[p++] = (byte) seq;
        }
        out[p] = (byte) acks.size();
        out[0] = (byte) (out[0] | PacketFraming.FLAG_APPENDED_ACKS);
        return out;
    }

    @Override
    public byte[] markResent(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");
        if (datagram.length < PacketFraming.HEADER_LENGTH) {
            throw new IllegalArgumentException("Not a datagram: " + datagram.length + " bytes");
        }
        byte[] out = datagram.clone();
        out[0] = (byte) (out[0] | PacketFraming.FLAG_RESENT);
        return out;
    }
}
