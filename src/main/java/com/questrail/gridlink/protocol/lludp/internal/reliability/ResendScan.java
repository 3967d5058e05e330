package com.questrail.gridlink.protocol.lludp.internal.reliability;

import java.util.List;

/**
 * Result of one resend scan.
 *
 * @param resend entries due for retransmission; {@code retries} already incremented
 * @param failed entries that exhausted their retries and were removed
 */
public record ResendScan(List<OutboundPending> resend, List<OutboundPending> failed)
{
    public ResendScan {
        resend = List.copyOf(resend);
        failed = List.copyOf(failed);
    }

    public boolean isEmpty()
    {
        return resend.isEmpty() && failed.isEmpty();
    }
}
