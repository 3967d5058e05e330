package com.questrail.gridlink.protocol.lludp.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every reliability and handshake decision.
 *
 * <h2>Binding invariant</h2>
 * Resend ages, ack-flush cadence and handshake deadlines MUST use this clock.
 * Wall-clock time ({@link WallClock}) is permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Monotonically increasing tick value in nanoseconds. Only meaningful for
     * elapsed time computations.
     */
    long nowNanos();
}
