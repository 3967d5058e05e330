package com.questrail.gridlink.protocol.lludp.internal.time;

/**
 * Cancellation handle for a scheduled circuit timer (resend scan, ack flush,
 * handshake timeout).
 */
public interface Cancellable
{
    /**
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
