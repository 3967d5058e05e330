package com.questrail.gridlink.protocol.lludp.quantize;

/**
 * UpdateKind
 * =============================================================================
 * Constant quantization tables, indexed by the kind of update being decoded.
 *
 * <h2>Position</h2>
 * <ul>
 *   <li>{@link #AVATAR}, {@link #OBJECT}, {@link #OBJECT_TERSE}: 16 bits per
 *       axis, unsigned, over the region extent 256 x 256 x 4096 metres.</li>
 *   <li>{@link #ATTACHMENT}: 8 bits per axis, signed, +/-10 metres from the
 *       attachment point.</li>
 *   <li>{@link #AVATAR_TERSE}: 8 bits per axis, signed, +/-4 metres from the
 *       last full position.</li>
 * </ul>
 *
 * <h2>Shared fields</h2>
 * Velocity and acceleration are 8-bit signed +/-64; angular velocity is 12-bit
 * signed +/-pi; rotation components are 16-bit signed +/-1 (see
 * {@link RotationPacking}).
 */
public enum UpdateKind
{
    AVATAR(PackedVectorSpec.uniform3(16, 256.0, 256.0, 4096.0)),
    OBJECT(PackedVectorSpec.uniform3(16, 256.0, 256.0, 4096.0)),
    ATTACHMENT(PackedVectorSpec.uniform(QuantizedFieldSpec.symmetric(8, 10.0))),
    AVATAR_TERSE(PackedVectorSpec.uniform(QuantizedFieldSpec.symmetric(8, 4.0))),
    OBJECT_TERSE(PackedVectorSpec.uniform3(16, 256.0, 256.0, 4096.0));

    public static final PackedVectorSpec VELOCITY =
            PackedVectorSpec.uniform(QuantizedFieldSpec.symmetric(8, 64.0));

    public static final PackedVectorSpec ACCELERATION =
            PackedVectorSpec.uniform(QuantizedFieldSpec.symmetric(8, 64.0));

    public static final PackedVectorSpec ANGULAR_VELOCITY =
            PackedVectorSpec.uniform(QuantizedFieldSpec.symmetric(12, Math.PI));

    public static final QuantizedFieldSpec ROTATION_COMPONENT = QuantizedFieldSpec.symmetric(16, 1.0);

    private final PackedVectorSpec position;

    UpdateKind(PackedVectorSpec position)
    {
        this.position = position;
    }

    public PackedVectorSpec position()
    {
        return position;
    }
}
