package com.questrail.gridlink.protocol.lludp.circuit;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters behind {@link CircuitStatistics}. Readable from any thread.
 */
final class StatisticsCounters
{
    final AtomicLong packetsSent = new AtomicLong();
    final AtomicLong bytesSent = new AtomicLong();
    final AtomicLong packetsReceived = new AtomicLong();
    final AtomicLong bytesReceived = new AtomicLong();
    final AtomicLong packetsResent = new AtomicLong();
    final AtomicLong duplicatesReceived = new AtomicLong();
    final AtomicLong malformedDatagrams = new AtomicLong();
    final AtomicLong unrecognizedMessages = new AtomicLong();
    final AtomicLong acksPiggybacked = new AtomicLong();
    final AtomicLong acksStandalone = new AtomicLong();
    final AtomicLong deliveryFailures = new AtomicLong();

    void sent(int bytes)
    {
        packetsSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    void received(int bytes)
    {
        packetsReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    CircuitStatistics snapshot()
    {
        return new CircuitStatistics(
                packetsSent.get(),
                bytesSent.get(),
                packetsReceived.get(),
                bytesReceived.get(),
                packetsResent.get(),
                duplicatesReceived.get(),
                malformedDatagrams.get(),
                unrecognizedMessages.get(),
                acksPiggybacked.get(),
                acksStandalone.get(),
                deliveryFailures.get());
    }
}
