package com.questrail.gridlink.protocol.lludp.codec.impl;

/**
 * PacketFraming
 * -----------------------------------------------------------------------------
 * Wire constants for the packet header.
 */
final class PacketFraming
{
    static final int FLAG_ZERO_CODED = 0x80;
    static final int FLAG_RELIABLE = 0x40;
    static final int FLAG_RESENT = 0x20;
    static final int FLAG_APPENDED_ACKS = 0x10;

    /** flags(1) + sequence(4) + extra length(1). */
    static final int HEADER_LENGTH = 6;

    /** Byte value that announces a longer message identifier. */
    static final int EXTENDED_ID = 0xFF;

    static final int ACK_LENGTH = 4;
    static final int MAX_APPENDED_ACKS = 0xFF;

    private PacketFraming() {}
}
