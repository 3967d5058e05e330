/**
 * LLUDP Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete UDP implementation and the
 * circuit layer. Everything above this package sees only:</p>
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations MUST perform transport I/O only. They do not decode,
 * acknowledge, resend or time anything out. Netty types stay inside
 * {@code transport.udp.netty}.
 */
package com.questrail.gridlink.protocol.lludp.transport;
