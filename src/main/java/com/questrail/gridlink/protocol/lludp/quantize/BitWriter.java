package com.questrail.gridlink.protocol.lludp.quantize;

import java.util.Arrays;

/**
 * Growable MSB-first bit writer; the counterpart of {@link BitReader}.
 */
public final class BitWriter
{
    private byte[] buffer;
    private int bitPosition;

    public BitWriter()
    {
        this(16);
    }

    public BitWriter(int initialCapacityBytes)
    {
        this.buffer = new byte[Math.max(1, initialCapacityBytes)];
    }

    public BitWriter writeBits(int n, long value)
    {
        ensureCapacity(bitPosition + n);
        BitPacking.writeBits(buffer, bitPosition, n, value);
        bitPosition += n;
        return this;
    }

    public BitWriter write(QuantizedFieldSpec spec, double value)
    {
        return writeBits(spec.bits(), spec.encode(value));
    }

    public int bitPosition()
    {
        return bitPosition;
    }

    /**
     * Written bits, padded with zero bits to a whole byte.
     */
    public byte[] toByteArray()
    {
        return Arrays.copyOf(buffer, (bitPosition + 7) >>> 3);
    }

    private void ensureCapacity(int bits)
    {
        int bytes = (bits + 7) >>> 3;
        if (bytes > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(bytes, buffer.length * 2));
        }
    }
}
