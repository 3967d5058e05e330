package com.questrail.gridlink.protocol.lludp.quantize;

import com.questrail.gridlink.math.Vector3;

import java.util.Objects;

/**
 * Per-axis field specs of a packed vector, written X, Y, Z.
 */
public record PackedVectorSpec(QuantizedFieldSpec x, QuantizedFieldSpec y, QuantizedFieldSpec z)
{
    public PackedVectorSpec {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(z, "z");
    }

    public static PackedVectorSpec uniform(QuantizedFieldSpec axis)
    {
        return new PackedVectorSpec(axis, axis, axis);
    }

    /**
     * Unsigned axes of the same width over {@code [0, maxX]}, {@code [0, maxY]}
     * and {@code [0, maxZ]}.
     */
    public static PackedVectorSpec uniform3(int bits, double maxX, double maxY, double maxZ)
    {
        return new PackedVectorSpec(
                QuantizedFieldSpec.unsigned(bits, 0.0, maxX),
                QuantizedFieldSpec.unsigned(bits, 0.0, maxY),
                QuantizedFieldSpec.unsigned(bits, 0.0, maxZ));
    }

    public int bits()
    {
        return x.bits() + y.bits() + z.bits();
    }

    public Vector3 read(BitReader in)
    {
        double vx = in.read(x);
        double vy = in.read(y);
        double vz = in.read(z);
        return new Vector3(vx, vy, vz);
    }

    public void write(BitWriter out, Vector3 v)
    {
        out.write(x, v.x());
        out.write(y, v.y());
        out.write(z, v.z());
    }
}
