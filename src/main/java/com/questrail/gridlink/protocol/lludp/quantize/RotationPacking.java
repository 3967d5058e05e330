package com.questrail.gridlink.protocol.lludp.quantize;

import com.questrail.gridlink.math.Quaternion;

import java.util.Objects;

/**
 * RotationPacking
 * -----------------------------------------------------------------------------
 * Packed unit quaternions: only X, Y and Z travel, each as a signed 16-bit
 * value scaled by 32767. W is rebuilt on decode.
 *
 * <h2>Reconstruction</h2>
 * <ol>
 *   <li>If {@code x²+y²+z² > 1} (quantization noise), X, Y, Z are scaled back
 *       onto the unit sphere.</li>
 *   <li>{@code w = sqrt(max(0, 1 - x² - y² - z²))}.</li>
 *   <li>The full quaternion is normalized before it is returned.</li>
 * </ol>
 * Overflow here is expected numeric noise, never an error.
 *
 * <p>Because W is always rebuilt non-negative, the packer flips quaternions
 * with {@code w < 0}. {@code q} and {@code -q} are the same rotation.</p>
 */
public final class RotationPacking
{
    /** Bits consumed by one packed rotation. */
    public static final int BITS = 3 * 16;

    private RotationPacking() {}

    public static Quaternion unpack(BitReader in)
    {
        QuantizedFieldSpec c = UpdateKind.ROTATION_COMPONENT;
        double x = in.read(c);
        double y = in.read(c);
        double z = in.read(c);
        return reconstruct(x, y, z);
    }

    public static Quaternion unpack(byte[] buffer, int bitOffset)
    {
        return unpack(new BitReader(buffer, bitOffset));
    }

    public static void pack(BitWriter out, Quaternion rotation)
    {
        Objects.requireNonNull(rotation, "rotation");
        Quaternion q = rotation.normalized();
        if (q.w() < 0) {
            q = q.negate();
        }
        QuantizedFieldSpec c = UpdateKind.ROTATION_COMPONENT;
        out.write(c, q.x());
        out.write(c, q.y());
        out.write(c, q.z());
    }

    public static byte[] pack(Quaternion rotation)
    {
        BitWriter w = new BitWriter(BITS / 8);
        pack(w, rotation);
        return w.toByteArray();
    }

    /**
     * Rebuild a unit quaternion from its vector part.
     */
    public static Quaternion reconstruct(double x, double y, double z)
    {
        double sumSq = x * x + y * y + z * z;
        if (sumSq > 1.0) {
            double n = Math.sqrt(sumSq);
            x /= n;
            y /= n;
            z /= n;
            sumSq = 1.0;
        }
        double w = Math.sqrt(Math.max(0.0, 1.0 - sumSq));
        return new Quaternion(x, y, z, w).normalized();
    }
}
