/**
 * LLUDP Codec (Wire-Level)
 * =============================================================================
 *
 * <p>The codec layer turns a complete UDP datagram into a decoded
 * {@link com.questrail.gridlink.protocol.lludp.model.Packet} and back.</p>
 *
 * <pre>
 *   byte[] datagram
 *        → header (flags, sequence, extra bytes)
 *        → strip appended acks from the tail
 *        → zero-decode (if flagged)
 *        → message identifier lookup
 *        → Packet
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>The codec knows nothing about circuits, sequences owed or resends.</li>
 *   <li>An identifier missing from the message table is an outcome, not an error.</li>
 *   <li>Message body layouts live in {@code model.message}, not here.</li>
 * </ul>
 */
package com.questrail.gridlink.protocol.lludp.codec;
