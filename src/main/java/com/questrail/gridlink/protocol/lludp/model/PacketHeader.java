package com.questrail.gridlink.protocol.lludp.model;

import java.util.Arrays;

/**
 * PacketHeader
 * -----------------------------------------------------------------------------
 * Decoded form of the fixed packet header.
 *
 * <pre>
 *   byte 0     flags (zero-coded 0x80, reliable 0x40, resent 0x20, appended acks 0x10)
 *   bytes 1-4  sequence number, big-endian
 *   byte 5     extra header length N
 *   N bytes    extra header
 * </pre>
 *
 * <p>The sequence number is an unsigned 32-bit value held in a {@code long}.</p>
 */
public record PacketHeader(
        boolean reliable,
        boolean resent,
        boolean hasAcks,
        boolean zeroCoded,
        long sequence,
        byte[] extra
) {
    public static final long MAX_SEQUENCE = 0xFFFFFFFFL;
    public static final int MAX_EXTRA_LENGTH = 0xFF;

    private static final byte[] NO_EXTRA = new byte[0];

    public PacketHeader {
        if (sequence < 0 || sequence > MAX_SEQUENCE) {
            throw new IllegalArgumentException("sequence out of 32-bit range: " + sequence);
        }
        extra = (extra == null) ? NO_EXTRA : extra.clone();
        if (extra.length > MAX_EXTRA_LENGTH) {
            throw new IllegalArgumentException("extra header longer than 255 bytes: " + extra.length);
        }
    }

    /**
     * Header for an outbound packet: no resent flag, no acks, no extra bytes.
     */
    public static PacketHeader outbound(boolean reliable, boolean zeroCoded, long sequence)
    {
        return new PacketHeader(reliable, false, false, zeroCoded, sequence, NO_EXTRA);
    }

    @Override
    public byte[] extra()
    {
        return extra.clone();
    }

    public int extraLength()
    {
        return extra.length;
    }

    public PacketHeader withZeroCoded(boolean zeroCoded)
    {
        return new PacketHeader(reliable, resent, hasAcks, zeroCoded, sequence, extra);
    }

    public PacketHeader withHasAcks(boolean hasAcks)
    {
        return new PacketHeader(reliable, resent, hasAcks, zeroCoded, sequence, extra);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PacketHeader other)) {
            return false;
        }
        return reliable == other.reliable
                && resent == other.resent
                && hasAcks == other.hasAcks
                && zeroCoded == other.zeroCoded
                && sequence == other.sequence
                && Arrays.equals(extra, other.extra);
    }

    @Override
    public int hashCode()
    {
        int h = Long.hashCode(sequence);
        h = 31 * h + (reliable ? 1 : 0);
        h = 31 * h + (resent ? 1 : 0);
        h = 31 * h + (hasAcks ? 1 : 0);
        h = 31 * h + (zeroCoded ? 1 : 0);
        return 31 * h + Arrays.hashCode(extra);
    }

    @Override
    public String toString()
    {
        return "PacketHeader[seq=" + sequence
                + (reliable ? ", reliable" : "")
                + (resent ? ", resent" : "")
                + (hasAcks ? ", acks" : "")
                + (zeroCoded ? ", zerocoded" : "")
                + (extra.length > 0 ? ", extra=" + extra.length : "")
                + "]";
    }
}
