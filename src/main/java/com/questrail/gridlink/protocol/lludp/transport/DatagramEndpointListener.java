package com.questrail.gridlink.protocol.lludp.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks may arrive on a transport thread. Receivers that own protocol
 * state must hand them to their event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The socket is bound and usable. Carries no protocol meaning.
     */
    void onTransportUp();

    /**
     * The socket became unusable.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete datagram, copied out of any framework buffer.
     *
     * @param remote  sender
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
