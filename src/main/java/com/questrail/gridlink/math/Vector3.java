package com.questrail.gridlink.math;

/**
 * Immutable three-component vector.
 */
public record Vector3(double x, double y, double z)
{
    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    public double length()
    {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public Vector3 subtract(Vector3 o)
    {
        return new Vector3(x - o.x, y - o.y, z - o.z);
    }
}
