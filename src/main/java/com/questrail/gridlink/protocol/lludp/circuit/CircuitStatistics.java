package com.questrail.gridlink.protocol.lludp.circuit;

/**
 * Point-in-time counters of one circuit.
 */
public record CircuitStatistics(
        long packetsSent,
        long bytesSent,
        long packetsReceived,
        long bytesReceived,
        long packetsResent,
        long duplicatesReceived,
        long malformedDatagrams,
        long unrecognizedMessages,
        long acksPiggybacked,
        long acksStandalone,
        long deliveryFailures
) {
}
