package com.questrail.gridlink.protocol.lludp.codec;

import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.util.List;

/**
 * PacketEncoder
 * -----------------------------------------------------------------------------
 * Inverse of {@link PacketDecoder}.
 *
 * <p>Encoding is split in two steps because acknowledgements are appended at
 * the last moment before a datagram leaves the circuit, while the bytes kept
 * for resend must not carry them.</p>
 */
public interface PacketEncoder
{
    /**
     * Encode header, message identifier and body.
     *
     * <p>If the header requests zero-coding but coding would not shrink the
     * payload, the datagram is written uncoded and the flag is cleared.</p>
     */
    byte[] encode(PacketHeader header, MessageType type, byte[] body);

    /**
     * Return a copy of {@code datagram} with {@code acks} appended and the
     * appended-acks flag set. At most 255 acks fit in one datagram.
     */
    byte[] appendAcks(byte[] datagram, List<Long> acks);

    /**
     * Return a copy of {@code datagram} with the resent flag set.
     */
    byte[] markResent(byte[] datagram);
}
