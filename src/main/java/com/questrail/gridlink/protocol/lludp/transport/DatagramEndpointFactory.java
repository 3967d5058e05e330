package com.questrail.gridlink.protocol.lludp.transport;

import java.net.InetSocketAddress;

/**
 * Creates one endpoint per circuit.
 */
@FunctionalInterface
public interface DatagramEndpointFactory
{
    /**
     * @param bindAddress local address; port 0 selects an ephemeral port
     */
    DatagramEndpoint create(InetSocketAddress bindAddress);
}
