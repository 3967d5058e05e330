package com.questrail.gridlink.protocol.lludp.internal.reliability;

import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ReliabilityEngine
 * =============================================================================
 * Per-circuit bookkeeping for at-least-once, duplicate-suppressed delivery.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Outbound sequence numbers: start at 1, strictly increasing in send
 *       order, wrapping at 2^32.</li>
 *   <li>OutboundPending: reliable packets awaiting acknowledgement.</li>
 *   <li>InboundSeenWindow: duplicate detection.</li>
 *   <li>PendingAcks: acknowledgements owed to the peer.</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * The engine performs no I/O and reads no clock. Time is passed in as
 * monotonic nanoseconds and every decision is returned to the caller, which
 * makes the engine fully deterministic under test.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. The owning circuit serializes access.
 */
public final class ReliabilityEngine
{
    private final long resendIntervalNanos;
    private final int maxResendCount;

    private final Map<Long, OutboundPending> outstanding = new LinkedHashMap<>();
    private final InboundSeenWindow seen;
    private final PendingAcks pendingAcks = new PendingAcks();

    private long nextSequence = 1;

    /**
     * @param resendInterval age after which an unacknowledged packet is resent
     * @param maxResendCount resends allowed before an entry is reported as failed
     * @param seenWindowSize inbound sequence numbers remembered for deduplication
     */
    public ReliabilityEngine(Duration resendInterval, int maxResendCount, int seenWindowSize)
    {
        Objects.requireNonNull(resendInterval, "resendInterval");
        if (resendInterval.isNegative() || resendInterval.isZero()) {
            throw new IllegalArgumentException("resendInterval must be positive");
        }
        if (maxResendCount < 0) {
            throw new IllegalArgumentException("maxResendCount must be >= 0");
        }
        this.resendIntervalNanos = resendInterval.toNanos();
        this.maxResendCount = maxResendCount;
        this.seen = new InboundSeenWindow(seenWindowSize);
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    /**
     * Sequence number the next call to {@link #nextSequence()} will return.
     */
    public long peekSequence()
    {
        return nextSequence;
    }

    /**
     * Assign the next sequence number. After {@code 0xFFFFFFFF} the counter
     * wraps to 1: sequence 0 is never sent.
     */
    public long nextSequence()
    {
        long seq = nextSequence;
        nextSequence = seq == PacketHeader.MAX_SEQUENCE ? 1 : seq + 1;
        return seq;
    }

    /**
     * Position the outbound counter, e.g. just below the wrap.
     */
    void seedSequence(long next)
    {
        if (next < 1 || next > PacketHeader.MAX_SEQUENCE) {
            throw new IllegalArgumentException("sequence out of range: " + next);
        }
        nextSequence = next;
    }

    /**
     * Record a reliable packet that has just been sent.
     */
    public void trackReliable(long sequence, MessageType type, byte[] bytes, long nowNanos)
    {
        outstanding.put(sequence, new OutboundPending(sequence, type, bytes, nowNanos, 0));
    }

    /**
     * Apply acknowledgements received from the peer.
     *
     * @return the entries that were outstanding and are now settled
     */
    public List<OutboundPending> onAcknowledged(Collection<Long> sequences)
    {
        if (sequences.isEmpty()) {
            return List.of();
        }
        List<OutboundPending> settled = new ArrayList<>(sequences.size());
        for (Long seq : sequences) {
            OutboundPending p = outstanding.remove(seq);
            if (p != null) {
                settled.add(p);
            }
        }
        return settled;
    }

    /**
     * Drop an entry without reporting it, e.g. when a fresh copy of the same
     * message replaces it.
     */
    public boolean forget(long sequence)
    {
        return outstanding.remove(sequence) != null;
    }

    public boolean isOutstanding(long sequence)
    {
        return outstanding.containsKey(sequence);
    }

    public int outstandingCount()
    {
        return outstanding.size();
    }

    /**
     * Oldest unacknowledged sequence number in send order, or 0 when nothing
     * is outstanding. 0 is never assigned, so it cannot be mistaken for a
     * real entry.
     */
    public long oldestOutstanding()
    {
        Iterator<Long> it = outstanding.keySet().iterator();
        return it.hasNext() ? it.next() : 0L;
    }

    /**
     * Find entries older than the resend interval. Entries that still have
     * retries left are re-stamped and returned for resend; the rest are
     * removed and returned as failed.
     */
    public ResendScan scanForResend(long nowNanos)
    {
        List<OutboundPending> resend = new ArrayList<>();
        List<OutboundPending> failed = new ArrayList<>();

        Iterator<Map.Entry<Long, OutboundPending>> it = outstanding.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, OutboundPending> e = it.next();
            OutboundPending p = e.getValue();
            if (nowNanos - p.sentAtNanos() < resendIntervalNanos) {
                continue;
            }
            if (p.retries() >= maxResendCount) {
                it.remove();
                failed.add(p);
            }
            else {
                OutboundPending next = p.resentAt(nowNanos);
                e.setValue(next);
                resend.add(next);
            }
        }
        return new ResendScan(resend, failed);
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    /**
     * Account for an inbound packet. Reliable packets always owe an ack, even
     * when they are duplicates: the peer may have missed the earlier one.
     */
    public InboundDisposition onInbound(long sequence, boolean reliable)
    {
        if (reliable) {
            pendingAcks.add(sequence);
        }
        return seen.record(sequence) ? InboundDisposition.DELIVER : InboundDisposition.DUPLICATE;
    }

    public boolean hasSeen(long sequence)
    {
        return seen.contains(sequence);
    }

    /**
     * Remove and return up to {@code max} owed acknowledgements, oldest first.
     */
    public List<Long> drainPendingAcks(int max)
    {
        if (max <= 0) {
            return List.of();
        }
        return pendingAcks.drain(max);
    }

    public int pendingAckCount()
    {
        return pendingAcks.size();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Discard all outstanding, seen and owed state. Used on circuit teardown.
     */
    public void clear()
    {
        outstanding.clear();
        seen.clear();
        pendingAcks.clear();
    }
}
