package com.questrail.gridlink.protocol.lludp.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one UDP socket. Each circuit owns exactly one endpoint.
 *
 * <p>The owning circuit is responsible for:</p>
 * <ul>
 *   <li>feeding inbound datagrams into the codec</li>
 *   <li>deduplication, acknowledgement and resend</li>
 *   <li>deciding when to send</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving.
     *
     * <p>On success the listener receives {@link DatagramEndpointListener#onTransportUp()}
     * once; on bind failure it receives
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} with the cause.</p>
     */
    void start();

    /**
     * Close the socket and release transport resources. Idempotent.
     */
    void stop();

    /**
     * Send one datagram. Silently ignored if the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
