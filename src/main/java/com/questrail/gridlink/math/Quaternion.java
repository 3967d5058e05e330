package com.questrail.gridlink.math;

/**
 * Immutable rotation quaternion {@code (x, y, z, w)}.
 */
public record Quaternion(double x, double y, double z, double w)
{
    public static final Quaternion IDENTITY = new Quaternion(0, 0, 0, 1);

    public double norm()
    {
        return Math.sqrt(x * x + y * y + z * z + w * w);
    }

    /**
     * Unit-length copy. A zero quaternion normalizes to {@link #IDENTITY}.
     */
    public Quaternion normalized()
    {
        double n = norm();
        if (n == 0.0) {
            return IDENTITY;
        }
        return new Quaternion(x / n, y / n, z / n, w / n);
    }

    public Quaternion negate()
    {
        return new Quaternion(-x, -y, -z, -w);
    }

    public double dot(Quaternion o)
    {
        return x * o.x + y * o.y + z * o.z + w * o.w;
    }
}
