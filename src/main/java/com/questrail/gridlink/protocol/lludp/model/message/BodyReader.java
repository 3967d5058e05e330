package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.Objects;
import java.util.UUID;

/**
 * BodyReader
 * -----------------------------------------------------------------------------
 * Sequential reader over a message body.
 *
 * <p>Message fields are little-endian. UUIDs are 16 raw bytes in network
 * order. Reading past the end throws {@link MessageBodyException}.</p>
 */
public final class BodyReader
{
    private final byte[] body;
    private int pos;

    public BodyReader(byte[] body)
    {
        this.body = Objects.requireNonNull(body, "body");
    }

    public int readU8()
    {
        require(1);
        return body[pos++] & 0xFF;
    }

    public int readU16()
    {
        require(2);
        int v = (body[pos] & 0xFF) | (body[pos + 1] & 0xFF) << 8;
        pos += 2;
        return v;
    }

    public long readU32()
    {
        require(4);
        long v = (body[pos] & 0xFFL)
                | (body[pos + 1] & 0xFFL) << 8
                | (body[pos + 2] & 0xFFL) << 16
                | (body[pos + 3] & 0xFFL) << 24;
        pos += 4;
        return v;
    }

    public UUID readUuid()
    {
        require(16);
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (body[pos + i] & 0xFF);
        }
        for (int i = 8; i < 16; i++) {
            lsb = (lsb << 8) | (body[pos + i] & 0xFF);
        }
        pos += 16;
        return new UUID(msb, lsb);
    }

    public int remaining()
    {
        return body.length - pos;
    }

    private void require(int n)
    {
        if (body.length - pos < n) {
            throw new MessageBodyException(
                    "Body truncated: need " + n + " bytes at offset " + pos + ", have " + (body.length - pos));
        }
    }
}
