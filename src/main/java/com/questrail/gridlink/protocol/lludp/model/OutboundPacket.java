package com.questrail.gridlink.protocol.lludp.model;

import java.util.Objects;

/**
 * A packet submitted for sending. The circuit assigns the sequence number and
 * builds the header at send time.
 */
public record OutboundPacket(
        MessageType type,
        byte[] body,
        boolean reliable,
        boolean zeroCoded
) {
    public OutboundPacket {
        Objects.requireNonNull(type, "type");
        body = Objects.requireNonNull(body, "body").clone();
    }

    public static OutboundPacket reliable(MessageType type, byte[] body)
    {
        return new OutboundPacket(type, body, true, false);
    }

    public static OutboundPacket unreliable(MessageType type, byte[] body)
    {
        return new OutboundPacket(type, body, false, false);
    }

    public OutboundPacket withZeroCoding()
    {
        return new OutboundPacket(type, body, reliable, true);
    }

    @Override
    public byte[] body()
    {
        return body.clone();
    }

    @Override
    public String toString()
    {
        return "OutboundPacket[" + type + ", body=" + body.length + "B"
                + (reliable ? ", reliable" : "")
                + (zeroCoded ? ", zerocoded" : "") + "]";
    }
}
