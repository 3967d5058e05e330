package com.questrail.gridlink.protocol.lludp.quantize;

import java.util.Objects;

/**
 * Sequential cursor over {@link BitPacking}.
 */
public final class BitReader
{
    private final byte[] buffer;
    private int bitPosition;

    public BitReader(byte[] buffer)
    {
        this(buffer, 0);
    }

    public BitReader(byte[] buffer, int bitOffset)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        if (bitOffset < 0) {
            throw new IllegalArgumentException("bitOffset must be >= 0");
        }
        this.bitPosition = bitOffset;
    }

    public long readBits(int n)
    {
        long v = BitPacking.readBits(buffer, bitPosition, n);
        bitPosition += n;
        return v;
    }

    public long readSignedBits(int n)
    {
        long v = BitPacking.readSignedBits(buffer, bitPosition, n);
        bitPosition += n;
        return v;
    }

    public double read(QuantizedFieldSpec spec)
    {
        return spec.decode(readBits(spec.bits()));
    }

    public int bitPosition()
    {
        return bitPosition;
    }

    public int remainingBits()
    {
        return buffer.length * 8 - bitPosition;
    }
}
