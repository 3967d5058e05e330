package com.questrail.gridlink.protocol.lludp.internal.reliability;

/**
 * What the circuit should do with the body of an inbound packet.
 */
public enum InboundDisposition
{
    /** First sighting: deliver. */
    DELIVER,

    /** Already seen: acknowledge again if reliable, do not deliver. */
    DUPLICATE
}
