package com.questrail.gridlink.protocol.lludp.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for observability timestamps only. Never use for
 * resend, flush or handshake timing.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
