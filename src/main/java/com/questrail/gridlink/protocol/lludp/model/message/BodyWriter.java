package com.questrail.gridlink.protocol.lludp.model.message;

import java.io.ByteArrayOutputStream;
import java.util.UUID;

/**
 * Little-endian counterpart of {@link BodyReader}.
 */
public final class BodyWriter
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public BodyWriter writeU8(int v)
    {
        if (v < 0 || v > 0xFF) {
            throw new IllegalArgumentException("U8 out of range: " + v);
        }
        out.write(v);
        return this;
    }

    public BodyWriter writeU16(int v)
    {
        out.write(v & 0xFF);
        out.write((v >>> 8) & 0xFF);
        return this;
    }

    public BodyWriter writeU32(long v)
    {
        if (v < 0 || v > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("U32 out of range: " + v);
        }
        for (int i = 0; i < 4; i++) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    public BodyWriter writeUuid(UUID id)
    {
        long msb = id.getMostSignificantBits();
        long lsb = id.getLeastSignificantBits();
        for (int i = 7; i >= 0; i--) {
            out.write((int) (msb >>> (8 * i)) & 0xFF);
        }
        for (int i = 7; i >= 0; i--) {
            out.write((int) (lsb >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    public byte[] toByteArray()
    {
        return out.toByteArray();
    }
}
