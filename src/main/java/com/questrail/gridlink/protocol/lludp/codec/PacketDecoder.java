package com.questrail.gridlink.protocol.lludp.codec;

/**
 * PacketDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for inbound datagrams.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the fixed header and extra header bytes</li>
 *   <li>Stripping appended acknowledgements from the datagram tail</li>
 *   <li>Reversing zero-coding</li>
 *   <li>Resolving the variable-width message identifier</li>
 * </ul>
 *
 * <p>It does not deduplicate, acknowledge or dispatch. Every failure is
 * reported as a {@link PacketDecodeResult}; implementations must not throw
 * for malformed input.</p>
 */
public interface PacketDecoder
{
    /**
     * Decode exactly one datagram.
     *
     * @param datagram raw bytes received from the transport
     * @return decode outcome; never {@code null}
     */
    PacketDecodeResult decode(byte[] datagram);
}
