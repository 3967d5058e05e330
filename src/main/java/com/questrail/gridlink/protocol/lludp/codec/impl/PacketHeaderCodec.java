package com.questrail.gridlink.protocol.lludp.codec.impl;

import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.util.Arrays;

/**
 * Reads and writes the fixed header and its extra bytes.
 */
final class PacketHeaderCodec
{
    private PacketHeaderCodec() {}

    static byte[] encode(PacketHeader header)
    {
        byte[] extra = header.extra();
        byte[] out = new byte[PacketFraming.HEADER_LENGTH + extra.length];

        int flags = 0;
        if (header.zeroCoded()) {
            flags |= PacketFraming.FLAG_ZERO_CODED;
        }
        if (header.reliable()) {
            flags |= PacketFraming.FLAG_RELIABLE;
        }
        if (header.resent()) {
            flags |= PacketFraming.FLAG_RESENT;
        }
        if (header.hasAcks()) {
            flags |= PacketFraming.FLAG_APPENDED_ACKS;
        }

        long seq = header.sequence();
        out[0] = (byte) flags;
        out[1] = (byte) (seq >>> 24);
        out[2] = (byte) (seq >>> 16);
        out[3] = (byte) (seq >>> 8);
        out[4] = (byte) seq;
        out[5] = (byte) extra.length;
        System.arraycopy(extra, 0, out, PacketFraming.HEADER_LENGTH, extra.length);
        return out;
    }

    static PacketHeader decode(byte[] datagram)
            throws MalformedPacketException
    {
        if (datagram.length < PacketFraming.HEADER_LENGTH) {
            throw new MalformedPacketException("Datagram shorter than header: " + datagram.length + " bytes");
        }

        int flags = datagram[0] & 0xFF;
        long seq = (datagram[1] & 0xFFL) << 24
                | (datagram[2] & 0xFFL) << 16
                | (datagram[3] & 0xFFL) << 8
                | (datagram[4] & 0xFFL);
        int extraLength = datagram[5] & 0xFF;

        if (datagram.length < PacketFraming.HEADER_LENGTH + extraLength) {
            throw new MalformedPacketException("Extra header of " + extraLength + " bytes exceeds datagram");
        }

        byte[] extra = Arrays.copyOfRange(datagram, PacketFraming.HEADER_LENGTH,
                PacketFraming.HEADER_LENGTH + extraLength);

        return new PacketHeader(
                (flags & PacketFraming.FLAG_RELIABLE) != 0,
                (flags & PacketFraming.FLAG_RESENT) != 0,
                (flags & PacketFraming.FLAG_APPENDED_ACKS) != 0,
                (flags & PacketFraming.FLAG_ZERO_CODED) != 0,
                seq,
                extra);
    }
}
