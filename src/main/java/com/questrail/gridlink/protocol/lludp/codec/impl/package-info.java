/**
 * LLUDP Codec (Concrete Implementation)
 * =============================================================================
 *
 * <pre>
 *   byte[] datagram
 *        → PacketHeaderCodec.decode
 *        → appended ack extraction
 *        → ZeroCoding.decode
 *        → MessageType.fromWireId
 *        → PacketDecodeResult
 * </pre>
 *
 * <p>Failures inside this package are signalled with package-private checked
 * exceptions and converted to {@code PacketDecodeResult.Malformed} at the
 * decoder boundary. Any failure at this layer results in the datagram being
 * dropped, never in the circuit being torn down.</p>
 */
package com.questrail.gridlink.protocol.lludp.codec.impl;
