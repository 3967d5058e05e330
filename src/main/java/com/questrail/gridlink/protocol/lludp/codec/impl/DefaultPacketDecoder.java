package com.questrail.gridlink.protocol.lludp.codec.impl;

import com.questrail.gridlink.protocol.lludp.codec.PacketDecodeResult;
import com.questrail.gridlink.protocol.lludp.codec.PacketDecoder;
import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.Packet;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * DefaultPacketDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PacketDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header and extra header bytes</li>
 *   <li>Appended acks: the last byte is a count, preceded by that many
 *       big-endian U32 sequence numbers. They are never zero-coded, so they
 *       are removed before zero-decoding.</li>
 *   <li>Zero-decoding of everything between the header and the acks</li>
 *   <li>Message identifier (1, 2 or 4 bytes)</li>
 * </ol>
 */
public final class DefaultPacketDecoder implements PacketDecoder
{
    public static final int DEFAULT_MAX_DECODED_SIZE = 8192;

    private final int maxDecodedSize;

    public DefaultPacketDecoder()
    {
        this(DEFAULT_MAX_DECODED_SIZE);
    }

    public DefaultPacketDecoder(int maxDecodedSize)
    {
        if (maxDecodedSize <= 0) {
            throw new IllegalArgumentException("maxDecodedSize must be positive");
        }
        this.maxDecodedSize = maxDecodedSize;
    }

    @Override
    public PacketDecodeResult decode(byte[] datagram)
    {
        if (datagram == null) {
            return new PacketDecodeResult.Malformed("null datagram");
        }

        try {
            // 1) Header
            final PacketHeader header = PacketHeaderCodec.decode(datagram);
            final int bodyStart = PacketFraming.HEADER_LENGTH + header.extraLength();

            // 2) Appended acks
            int end = datagram.length;
            final List<Long> acks;
            if (header.hasAcks()) {
                if (end - 1 < bodyStart) {
                    throw new MalformedPacketException("Ack flag set but no ack count byte");
                }
                int count = datagram[end - 1] & 0xFF;
                int ackStart = end - 1 - count * PacketFraming.ACK_LENGTH;
                if (ackStart < bodyStart) {
                    throw new MalformedPacketException("Appended ack count " + count + " exceeds datagram");
                }
                acks = readAcks(datagram, ackStart, count);
                end = ackStart;
            }
            else {
                acks = List.of();
            }

            // 3) Zero-decoding
            byte[] payload = Arrays.copyOfRange(datagram, bodyStart, end);
            if (header.zeroCoded()) {
                payload = ZeroCoding.decode(payload, maxDecodedSize);
            }

            // 4) Message identifier
            if (payload.length < 1) {
                throw new MalformedPacketException("No message identifier");
            }
            final int idLength;
            final long wireId;
            int b0 = payload[0] & 0xFF;
            if (b0 != PacketFraming.EXTENDED_ID) {
                idLength = 1;
                wireId = b0;
            }
            else if (payload.length < 2) {
                throw new MalformedPacketException("Truncated medium message identifier");
            }
            else if ((payload[1] & 0xFF) != PacketFraming.EXTENDED_ID) {
                idLength = 2;
                wireId = 0xFF00L | (payload[1] & 0xFF);
            }
            else if (payload.length < 4) {
                throw new MalformedPacketException("Truncated low message identifier");
            }
            else {
                idLength = 4;
                wireId = 0xFFFF0000L | (payload[2] & 0xFFL) << 8 | (payload[3] & 0xFFL);
            }

            Optional<MessageType> type = MessageType.fromWireId(wireId);
            if (type.isEmpty()) {
                return new PacketDecodeResult.Unrecognized(header, wireId, acks);
            }

            byte[] body = Arrays.copyOfRange(payload, idLength, payload.length);
            return new PacketDecodeResult.Decoded(new Packet(header, type.get(), body, acks));
        }
        catch (MalformedPacketException | ZeroCodingException e) {
            return new PacketDecodeResult.Malformed(e.getMessage());
        }
    }

    private static List<Long> readAcks(byte[] datagram, int offset, int count)
    {
        List<Long> acks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int p = offset + i * PacketFraming.ACK_LENGTH;
            acks.add((datagram[p] & 0xFFL) << 24
                    | (datagram[p + 1] & 0xFFL) << 16
                    | (datagram[p + 2] & 0xFFL) << 8
                    | (datagram[p + 3] & 0xFFL));
        }
        return acks;
    }
}
