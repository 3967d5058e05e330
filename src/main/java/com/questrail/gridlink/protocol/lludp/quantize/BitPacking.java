package com.questrail.gridlink.protocol.lludp.quantize;

import java.util.Objects;

/**
 * BitPacking
 * -----------------------------------------------------------------------------
 * Arbitrary-width bit fields over a byte buffer.
 *
 * <p>Bits are addressed most-significant first: bit offset 0 is the top bit of
 * byte 0. Fields may span byte boundaries. Widths are 1 to 32 bits; values are
 * returned in a {@code long} so a 32-bit field stays unsigned.</p>
 */
public final class BitPacking
{
    public static final int MAX_BITS = 32;

    private BitPacking() {}

    /**
     * Read an unsigned {@code n}-bit field.
     *
     * @throws BitBufferUnderflowException if the field extends past the buffer
     */
    public static long readBits(byte[] buffer, int bitOffset, int n)
    {
        checkField(buffer, bitOffset, n);

        long value = 0;
        for (int i = 0; i < n; i++) {
            int bit = bitOffset + i;
            int b = buffer[bit >>> 3] & 0xFF;
            value = (value << 1) | ((b >>> (7 - (bit & 7))) & 1);
        }
        return value;
    }

    /**
     * Read an {@code n}-bit two's-complement field.
     */
    public static long readSignedBits(byte[] buffer, int bitOffset, int n)
    {
        return toSigned(readBits(buffer, bitOffset, n), n);
    }

    /**
     * Write the low {@code n} bits of {@code value} at {@code bitOffset}.
     */
    public static void writeBits(byte[] buffer, int bitOffset, int n, long value)
    {
        checkField(buffer, bitOffset, n);

        for (int i = 0; i < n; i++) {
            int bit = bitOffset + i;
            int mask = 1 << (7 - (bit & 7));
            if (((value >>> (n - 1 - i)) & 1L) != 0) {
                buffer[bit >>> 3] |= (byte) mask;
            }
            else {
                buffer[bit >>> 3] &= (byte) ~mask;
            }
        }
    }

    /**
     * Sign-extend an unsigned {@code n}-bit value.
     */
    public static long toSigned(long raw, int n)
    {
        long top = 1L << (n - 1);
        return (raw & top) != 0 ? raw - (1L << n) : raw;
    }

    static long mask(int n)
    {
        return (1L << n) - 1;
    }

    private static void checkField(byte[] buffer, int bitOffset, int n)
    {
        Objects.requireNonNull(buffer, "buffer");
        if (n < 1 || n > MAX_BITS) {
            throw new IllegalArgumentException("bit width must be 1..32, got " + n);
        }
        if (bitOffset < 0) {
            throw new IllegalArgumentException("bitOffset must be >= 0, got " + bitOffset);
        }
        long bufferBits = (long) buffer.length * 8;
        if (bitOffset + (long) n > bufferBits) {
            throw new BitBufferUnderflowException(bitOffset, n, (int) bufferBits);
        }
    }
}
