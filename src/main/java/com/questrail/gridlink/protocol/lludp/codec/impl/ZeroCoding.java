package com.questrail.gridlink.protocol.lludp.codec.impl;

import java.io.ByteArrayOutputStream;

/**
 * ZeroCoding
 * -----------------------------------------------------------------------------
 * Run-length coding of zero bytes.
 *
 * <p>A run of {@code n} zero bytes ({@code 1 <= n <= 255}) is written as the
 * pair {@code 00 n}. Longer runs are split into several pairs. Non-zero bytes
 * are copied unchanged.</p>
 *
 * <p>This class is purely mechanical. Which part of a datagram is coded is
 * decided by the encoder and decoder.</p>
 */
final class ZeroCoding
{
    private static final int MAX_RUN = 0xFF;

    private ZeroCoding() {}

    static byte[] encode(byte[] plain)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(plain.length + 8);
        int i = 0;
        while (i < plain.length) {
            if (plain[i] != 0) {
                out.write(plain[i++]);
                continue;
            }
            int run = 0;
            while (i < plain.length && plain[i] == 0 && run < MAX_RUN) {
                run++;
                i++;
            }
            out.write(0);
            out.write(run);
        }
        return out.toByteArray();
    }

    /**
     * @param coded          zero-coded bytes
     * @param maxDecodedSize upper bound on the decoded length
     */
    static byte[] decode(byte[] coded, int maxDecodedSize)
            throws ZeroCodingException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxDecodedSize, coded.length * 2));
        int size = 0;

        for (int r = 0; r < coded.length; r++) {
            int b = coded[r] & 0xFF;
            if (b != 0) {
                size++;
                if (size > maxDecodedSize) {
                    throw new ZeroCodingException("Decoded size exceeds " + maxDecodedSize + " bytes");
                }
                out.write(b);
                continue;
            }

            if (r + 1 >= coded.length) {
                throw new ZeroCodingException("Dangling zero byte at end of coded data");
            }
            int run = coded[++r] & 0xFF;
            if (run == 0) {
                throw new ZeroCodingException("Zero run length at offset " + r);
            }
            size += run;
            if (size > maxDecodedSize) {
                throw new ZeroCodingException("Decoded size exceeds " + maxDecodedSize + " bytes");
            }
            for (int k = 0; k < run; k++) {
                out.write(0);
            }
        }
        return out.toByteArray();
    }
}
