package com.questrail.gridlink.protocol.lludp.model.message;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Layout checks for the bodies the circuit itself produces and consumes.
 */
final class ControlMessageBodyTest
{
    private static final UUID AGENT = UUID.fromString("00112233-4455-6677-8899-aabbccddeeff");
    private static final UUID SESSION = UUID.fromString("ffeeddcc-bbaa-9988-7766-554433221100");

    @Test
    void useCircuitCodeIsLittleEndianCodeThenRawUuids()
    {
        byte[] body = new UseCircuitCode(0x01020304L, SESSION, AGENT).toBody();

        assertEquals(36, body.length);
        assertArrayEquals(new byte[]{0x04, 0x03, 0x02, 0x01}, java.util.Arrays.copyOf(body, 4));
        assertEquals((byte) 0xFF, body[4]);
        assertEquals((byte) 0x00, body[20]);
        assertEquals((byte) 0xFF, body[35]);

        UseCircuitCode back = UseCircuitCode.fromBody(body);
        assertEquals(0x01020304L, back.circuitCode());
        assertEquals(SESSION, back.sessionId());
        assertEquals(AGENT, back.agentId());
    }

    @Test
    void packetAckBodyIsCountThenSequences()
    {
        byte[] body = new PacketAck(List.of(1L, 0x100L)).toBody();

        assertArrayEquals(new byte[]{2, 1, 0, 0, 0, 0, 1, 0, 0}, body);
        assertEquals(List.of(1L, 0x100L), PacketAck.fromBody(body).sequences());
    }

    @Test
    void packetAckCapsAt255()
    {
        List<Long> many = java.util.Collections.nCopies(256, 1L);
        assertThrows(IllegalArgumentException.class, () -> new PacketAck(many));
    }

    @Test
    void pingBodies()
    {
        byte[] start = new StartPingCheck(9, 77L).toBody();
        assertArrayEquals(new byte[]{9, 77, 0, 0, 0}, start);
        assertEquals(new StartPingCheck(9, 77L), StartPingCheck.fromBody(start));

        assertEquals(new CompletePingCheck(9), CompletePingCheck.fromBody(new CompletePingCheck(9).toBody()));
    }

    @Test
    void handshakeAndMovementBodies()
    {
        RegionHandshakeReply reply = new RegionHandshakeReply(AGENT, SESSION, RegionHandshakeReply.DEFAULT_FLAGS);
        byte[] body = reply.toBody();
        assertEquals(36, body.length);
        assertEquals(7, body[32]);
        assertEquals(reply, RegionHandshakeReply.fromBody(body));

        CompleteAgentMovement cam = new CompleteAgentMovement(AGENT, SESSION, 42L);
        assertEquals(cam, CompleteAgentMovement.fromBody(cam.toBody()));

        LogoutRequest logout = new LogoutRequest(AGENT, SESSION);
        assertEquals(32, logout.toBody().length);
        assertEquals(logout, LogoutRequest.fromBody(logout.toBody()));
    }

    @Test
    void truncatedBodyThrowsMessageBodyException()
    {
        assertThrows(MessageBodyException.class, () -> UseCircuitCode.fromBody(new byte[10]));
        assertThrows(MessageBodyException.class, () -> StartPingCheck.fromBody(new byte[]{1, 2}));
        assertThrows(MessageBodyException.class, () -> PacketAck.fromBody(new byte[]{3, 0, 0, 0, 1}));
    }

    @Test
    void writerRejectsOutOfRangeValues()
    {
        assertThrows(IllegalArgumentException.class, () -> new BodyWriter().writeU8(256));
        assertThrows(IllegalArgumentException.class, () -> new BodyWriter().writeU32(-1));
    }
}
