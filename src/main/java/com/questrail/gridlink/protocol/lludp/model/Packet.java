package com.questrail.gridlink.protocol.lludp.model;

import java.util.List;
import java.util.Objects;

/**
 * A fully decoded inbound packet: header, resolved message type and the
 * zero-decoded body that follows the message identifier.
 *
 * <p>{@code appendedAcks} lists the sequence numbers the peer acknowledged by
 * appending them to this datagram. They belong to the reliability layer, not
 * to message handlers.</p>
 */
public record Packet(
        PacketHeader header,
        MessageType type,
        byte[] body,
        List<Long> appendedAcks
) {
    public Packet {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(type, "type");
        body = Objects.requireNonNull(body, "body").clone();
        appendedAcks = List.copyOf(Objects.requireNonNull(appendedAcks, "appendedAcks"));
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    public long sequence()
    {
        return header.sequence();
    }

    @Override
    public String toString()
    {
        return "Packet[" + type + ", " + header + ", body=" + body.length + "B, acks=" + appendedAcks.size() + "]";
    }
}
