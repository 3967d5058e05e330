package com.questrail.gridlink.protocol.lludp.internal.reliability;

import com.questrail.gridlink.protocol.lludp.model.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReliabilityEngineTest
 * -----------------------------------------------------------------------------
 * Pure bookkeeping tests. Time is passed in explicitly, so no clock or
 * scheduler is involved.
 */
final class ReliabilityEngineTest
{
    private static final long MS = 1_000_000L;

    private ReliabilityEngine engine;

    @BeforeEach
    void setUp()
    {
        engine = new ReliabilityEngine(Duration.ofMillis(4000), 3, 8);
    }

    private void sendReliable(long nowNanos)
    {
        long seq = engine.nextSequence();
        engine.trackReliable(seq, MessageType.ChatFromViewer, new byte[]{(byte) seq}, nowNanos);
    }

    private static List<Long> sequences(List<OutboundPending> entries)
    {
        return entries.stream().map(OutboundPending::sequence).collect(Collectors.toList());
    }

    // -------------------------------------------------------------------------
    // Sequence numbers
    // -------------------------------------------------------------------------

    @Test
    void sequencesStartAtOneAndIncrease()
    {
        assertEquals(1, engine.peekSequence());
        assertEquals(1, engine.nextSequence());
        assertEquals(2, engine.nextSequence());
        assertEquals(3, engine.peekSequence());
    }

    // -------------------------------------------------------------------------
    // Outbound acknowledgement and resend
    // -------------------------------------------------------------------------

    @Test
    void onlyUnacknowledgedPacketsAreResent()
    {
        engine.nextSequence();
        engine.nextSequence();
        engine.nextSequence();
        engine.nextSequence();
        sendReliable(0);          // 5
        sendReliable(0);          // 6
        sendReliable(0);          // 7

        List<OutboundPending> settled = engine.onAcknowledged(List.of(6L));
        assertEquals(List.of(6L), sequences(settled));

        ResendScan early = engine.scanForResend(3999 * MS);
        assertTrue(early.isEmpty());

        ResendScan scan = engine.scanForResend(4000 * MS);
        assertEquals(List.of(5L, 7L), sequences(scan.resend()));
        assertTrue(scan.failed().isEmpty());
        assertEquals(1, scan.resend().get(0).retries());
    }

    @Test
    void unknownAndRepeatedAcksAreIgnored()
    {
        sendReliable(0);

        assertTrue(engine.onAcknowledged(List.of(99L)).isEmpty());
        assertEquals(1, engine.onAcknowledged(List.of(1L, 1L)).size());
        assertTrue(engine.onAcknowledged(List.of(1L)).isEmpty());
        assertEquals(0, engine.outstandingCount());
    }

    @Test
    void entryFailsAfterMaxResends()
    {
        sendReliable(0);

        for (int i = 1; i <= 3; i++) {
            ResendScan scan = engine.scanForResend(i * 4000 * MS);
            assertEquals(List.of(1L), sequences(scan.resend()), "resend " + i);
            assertEquals(i, scan.resend().get(0).retries());
        }

        ResendScan last = engine.scanForResend(4 * 4000 * MS);
        assertTrue(last.resend().isEmpty());
        assertEquals(List.of(1L), sequences(last.failed()));
        assertFalse(engine.isOutstanding(1));
    }

    @Test
    void resendIsMeasuredFromLastTransmission()
    {
        sendReliable(0);
        engine.scanForResend(4000 * MS);

        assertTrue(engine.scanForResend(7999 * MS).isEmpty());
        assertFalse(engine.scanForResend(8000 * MS).isEmpty());
    }

    @Test
    void resendKeepsOriginalBytes()
    {
        sendReliable(0);

        OutboundPending again = engine.scanForResend(4000 * MS).resend().get(0);

        assertArrayEquals(new byte[]{1}, again.bytes());
        assertEquals(MessageType.ChatFromViewer, again.type());
    }

    @Test
    void oldestOutstandingFollowsSendOrder()
    {
        assertEquals(0, engine.oldestOutstanding());
        sendReliable(0);
        sendReliable(0);
        engine.onAcknowledged(List.of(1L));

        assertEquals(2, engine.oldestOutstanding());
        assertTrue(engine.forget(2));
        assertEquals(0, engine.oldestOutstanding());
    }

    @Test
    void trackedBytesAreIsolatedFromTheCaller()
    {
        byte[] datagram = {1, 2, 3};
        engine.trackReliable(engine.nextSequence(), MessageType.ChatFromViewer, datagram, 0);
        datagram[0] = 99;

        OutboundPending again = engine.scanForResend(4000 * MS).resend().get(0);
        again.bytes()[1] = 99;

        assertArrayEquals(new byte[]{1, 2, 3}, engine.scanForResend(8000 * MS).resend().get(0).bytes());
    }

    // -------------------------------------------------------------------------
    // Sequence wrap
    // -------------------------------------------------------------------------

    @Test
    void sequenceWrapsToOneSkippingZero()
    {
        engine.seedSequence(0xFFFFFFFEL);

        assertEquals(0xFFFFFFFEL, engine.nextSequence());
        assertEquals(0xFFFFFFFFL, engine.nextSequence());
        assertEquals(1L, engine.nextSequence());
        assertEquals(2L, engine.nextSequence());
    }

    @Test
    void reliablePacketsAcrossTheWrapAreTrackedAndAcked()
    {
        engine.seedSequence(0xFFFFFFFFL);
        sendReliable(0);
        sendReliable(0);

        assertTrue(engine.isOutstanding(0xFFFFFFFFL));
        assertTrue(engine.isOutstanding(1L));
        assertFalse(engine.isOutstanding(0L));
        assertEquals(0xFFFFFFFFL, engine.oldestOutstanding());

        engine.onAcknowledged(List.of(0xFFFFFFFFL));
        assertEquals(1L, engine.oldestOutstanding());

        List<OutboundPending> resent = engine.scanForResend(4000 * MS).resend();
        assertEquals(List.of(1L), sequences(resent));
    }

    @Test
    void seedRejectsZeroAndOutOfRange()
    {
        assertThrows(IllegalArgumentException.class, () -> engine.seedSequence(0));
        assertThrows(IllegalArgumentException.class, () -> engine.seedSequence(0x1_0000_0000L));
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    @Test
    void duplicateReliablePacketIsReAcked()
    {
        assertEquals(InboundDisposition.DELIVER, engine.onInbound(10, true));
        assertEquals(List.of(10L), engine.drainPendingAcks(10));

        assertEquals(InboundDisposition.DUPLICATE, engine.onInbound(10, true));
        assertEquals(List.of(10L), engine.drainPendingAcks(10));
    }

    @Test
    void unreliablePacketsOweNoAck()
    {
        assertEquals(InboundDisposition.DELIVER, engine.onInbound(3, false));
        assertEquals(0, engine.pendingAckCount());
        assertEquals(InboundDisposition.DUPLICATE, engine.onInbound(3, false));
    }

    @Test
    void pendingAcksDrainOldestFirstInChunks()
    {
        for (long s = 20; s < 25; s++) {
            engine.onInbound(s, true);
        }
        engine.onInbound(20, true);

        assertEquals(List.of(20L, 21L, 22L), engine.drainPendingAcks(3));
        assertEquals(List.of(23L, 24L), engine.drainPendingAcks(3));
        assertTrue(engine.drainPendingAcks(3).isEmpty());
        assertTrue(engine.drainPendingAcks(0).isEmpty());
    }

    @Test
    void clearDiscardsEverything()
    {
        sendReliable(0);
        engine.onInbound(5, true);

        engine.clear();

        assertEquals(0, engine.outstandingCount());
        assertEquals(0, engine.pendingAckCount());
        assertFalse(engine.hasSeen(5));
    }

    @Test
    void constructorValidation()
    {
        assertThrows(IllegalArgumentException.class, () -> new ReliabilityEngine(Duration.ZERO, 3, 8));
        assertThrows(IllegalArgumentException.class, () -> new ReliabilityEngine(Duration.ofSeconds(1), -1, 8));
        assertThrows(IllegalArgumentException.class, () -> new ReliabilityEngine(Duration.ofSeconds(1), 3, 0));
    }
}
