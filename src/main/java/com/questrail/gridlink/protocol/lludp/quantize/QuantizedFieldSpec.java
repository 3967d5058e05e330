package com.questrail.gridlink.protocol.lludp.quantize;

/**
 * QuantizedFieldSpec
 * -----------------------------------------------------------------------------
 * How one scalar is packed: bit width, range and signedness.
 *
 * <p>Signed specs are symmetric ({@code min == -max}) and decode the field as
 * two's complement before scaling. Specs are protocol constants; see
 * {@link UpdateKind}.</p>
 */
public record QuantizedFieldSpec(int bits, double min, double max, boolean signed)
{
    public QuantizedFieldSpec {
        if (bits < 1 || bits > BitPacking.MAX_BITS) {
            throw new IllegalArgumentException("bits must be 1..32, got " + bits);
        }
        if (!(max > min)) {
            throw new IllegalArgumentException("max must exceed min");
        }
        if (signed) {
            if (bits < 2) {
                throw new IllegalArgumentException("signed fields need at least 2 bits");
            }
            if (min != -max) {
                throw new IllegalArgumentException("signed fields must have a symmetric range");
            }
        }
    }

    public static QuantizedFieldSpec unsigned(int bits, double min, double max)
    {
        return new QuantizedFieldSpec(bits, min, max, false);
    }

    public static QuantizedFieldSpec symmetric(int bits, double range)
    {
        return new QuantizedFieldSpec(bits, -range, range, true);
    }

    /**
     * Decode the raw (unsigned) bit pattern of this field.
     */
    public double decode(long fieldBits)
    {
        if (signed) {
            return Quantizer.dequantizeSigned(BitPacking.toSigned(fieldBits, bits), bits, max);
        }
        return Quantizer.dequantize(fieldBits, bits, min, max);
    }

    /**
     * Encode {@code value} to the bit pattern written on the wire.
     */
    public long encode(double value)
    {
        if (signed) {
            return Quantizer.quantizeSigned(value, bits, max) & BitPacking.mask(bits);
        }
        return Quantizer.quantize(value, bits, min, max);
    }

    /**
     * Largest error a round trip through this spec may introduce.
     */
    public double step()
    {
        if (signed) {
            return max / (double) BitPacking.mask(bits - 1);
        }
        return Quantizer.step(bits, min, max);
    }
}
