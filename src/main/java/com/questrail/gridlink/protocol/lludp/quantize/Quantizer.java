package com.questrail.gridlink.protocol.lludp.quantize;

/**
 * Quantizer
 * -----------------------------------------------------------------------------
 * Fixed-point mapping between {@code n}-bit integers and bounded floats.
 *
 * <h2>Unsigned form</h2>
 * <pre>
 *   dequantize(raw, n, min, max) = min + raw / (2^n - 1) * (max - min)
 *   quantize(x, n, min, max)     = round((x - min) / (max - min) * (2^n - 1))
 * </pre>
 * The quantized value is clamped to {@code [0, 2^n - 1]}.
 *
 * <h2>Signed (symmetric) form</h2>
 * <pre>
 *   dequantizeSigned(s, n, range) = s * range / (2^(n-1) - 1)
 * </pre>
 * where {@code s} is the two's-complement value of the field. The most
 * negative raw value decodes slightly past {@code -range} and is clamped.
 *
 * <p>Round-tripping in either form stays within one quantization step.</p>
 */
public final class Quantizer
{
    private Quantizer() {}

    public static double dequantize(long raw, int n, double min, double max)
    {
        checkBits(n);
        long top = BitPacking.mask(n);
        if (raw < 0 || raw > top) {
            throw new IllegalArgumentException("raw " + raw + " does not fit in " + n + " bits");
        }
        return min + ((double) raw / (double) top) * (max - min);
    }

    public static long quantize(double value, int n, double min, double max)
    {
        checkBits(n);
        long top = BitPacking.mask(n);
        double clamped = clamp(value, min, max);
        long raw = Math.round((clamped - min) / (max - min) * (double) top);
        return Math.max(0, Math.min(top, raw));
    }

    public static double dequantizeSigned(long signedRaw, int n, double range)
    {
        checkSignedBits(n);
        long scale = BitPacking.mask(n - 1);
        return clamp(signedRaw * range / (double) scale, -range, range);
    }

    public static long quantizeSigned(double value, int n, double range)
    {
        checkSignedBits(n);
        long scale = BitPacking.mask(n - 1);
        return Math.round(clamp(value, -range, range) / range * (double) scale);
    }

    /**
     * Width of one quantization step of an unsigned field.
     */
    public static double step(int n, double min, double max)
    {
        checkBits(n);
        return (max - min) / (double) BitPacking.mask(n);
    }

    static double clamp(double v, double lo, double hi)
    {
        if (Double.isNaN(v)) {
            return lo;
        }
        return Math.max(lo, Math.min(hi, v));
    }

    private static void checkBits(int n)
    {
        if (n < 1 || n > BitPacking.MAX_BITS) {
            throw new IllegalArgumentException("bit width must be 1..32, got " + n);
        }
    }

    private static void checkSignedBits(int n)
    {
        if (n < 2 || n > BitPacking.MAX_BITS) {
            throw new IllegalArgumentException("signed bit width must be 2..32, got " + n);
        }
    }
}
