package com.questrail.gridlink.protocol.lludp.codec.impl;

import com.questrail.gridlink.protocol.lludp.model.PacketHeader;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PacketHeaderCodecTest
{
    @Test
    void flagsAndSequenceAreBigEndian() throws Exception
    {
        PacketHeader header = new PacketHeader(true, true, false, true, 0x01020304L, null);

        byte[] wire = PacketHeaderCodec.encode(header);

        assertArrayEquals(new byte[]{(byte) 0xE0, 0x01, 0x02, 0x03, 0x04, 0x00}, wire);
        assertEquals(header, PacketHeaderCodec.decode(wire));
    }

    @Test
    void extraHeaderBytesAreCarried() throws Exception
    {
        byte[] wire = {0x10, 0, 0, 0, 7, 2, (byte) 0xAA, (byte) 0xBB, 0x01};

        PacketHeader header = PacketHeaderCodec.decode(wire);

        assertTrue(header.hasAcks());
        assertFalse(header.reliable());
        assertEquals(7, header.sequence());
        assertArrayEquals(new byte[]{(byte) 0xAA, (byte) 0xBB}, header.extra());
    }

    @Test
    void maximumSequenceSurvives() throws Exception
    {
        PacketHeader header = PacketHeader.outbound(false, false, PacketHeader.MAX_SEQUENCE);
        assertEquals(PacketHeader.MAX_SEQUENCE, PacketHeaderCodec.decode(PacketHeaderCodec.encode(header)).sequence());
    }

    @Test
    void shortDatagramIsMalformed()
    {
        assertThrows(MalformedPacketException.class, () -> PacketHeaderCodec.decode(new byte[]{0x40, 0, 0, 0}));
    }

    @Test
    void extraLengthPastEndIsMalformed()
    {
        assertThrows(MalformedPacketException.class,
                () -> PacketHeaderCodec.decode(new byte[]{0x00, 0, 0, 0, 1, 5, 0x01}));
    }

    @Test
    void headerRejectsOutOfRangeSequence()
    {
        assertThrows(IllegalArgumentException.class, () -> PacketHeader.outbound(false, false, -1));
        assertThrows(IllegalArgumentException.class, () -> PacketHeader.outbound(false, false, 1L << 32));
    }
}
