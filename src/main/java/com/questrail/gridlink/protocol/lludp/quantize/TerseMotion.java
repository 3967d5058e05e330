package com.questrail.gridlink.protocol.lludp.quantize;

import com.questrail.gridlink.math.Quaternion;
import com.questrail.gridlink.math.Vector3;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * TerseMotion
 * -----------------------------------------------------------------------------
 * Bit-packed motion block of a terse update. Only the fields named by the
 * block's layout are on the wire, always in this order: position
 * ({@link UpdateKind#position()}), velocity, acceleration, rotation, angular
 * velocity.
 *
 * <p>Avatar and object terse updates carry {@link #POSITION_ROTATION}; full
 * updates announce their fields with flag bits (see {@link Field#fromFlags}).
 * A field that is not present decodes as zero, or as the identity rotation.</p>
 */
public record TerseMotion(
        Set<Field> present,
        Vector3 position,
        Vector3 velocity,
        Vector3 acceleration,
        Quaternion rotation,
        Vector3 angularVelocity
) {
    /**
     * A field of the motion block, with its bit in the update flags byte.
     */
    public enum Field
    {
        POSITION(0x01),
        VELOCITY(0x02),
        ACCELERATION(0x04),
        ROTATION(0x08),
        ANGULAR_VELOCITY(0x20);

        private final int flag;

        Field(int flag)
        {
            this.flag = flag;
        }

        public int flag()
        {
            return flag;
        }

        /**
         * Fields announced by an update flags byte. Bits that name no motion
         * field (parent id, attachment) are ignored.
         */
        public static EnumSet<Field> fromFlags(int flags)
        {
            EnumSet<Field> fields = EnumSet.noneOf(Field.class);
            for (Field f : values()) {
                if ((flags & f.flag) != 0) {
                    fields.add(f);
                }
            }
            return fields;
        }
    }

    public static final Set<Field> POSITION_ROTATION =
            Collections.unmodifiableSet(EnumSet.of(Field.POSITION, Field.ROTATION));

    public static final Set<Field> ALL_FIELDS =
            Collections.unmodifiableSet(EnumSet.allOf(Field.class));

    public TerseMotion {
        Objects.requireNonNull(present, "present");
        present = present.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Field.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(present));
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(acceleration, "acceleration");
        Objects.requireNonNull(rotation, "rotation");
        Objects.requireNonNull(angularVelocity, "angularVelocity");
    }

    /**
     * Block with every field present.
     */
    public TerseMotion(Vector3 position, Vector3 velocity, Vector3 acceleration,
                       Quaternion rotation, Vector3 angularVelocity)
    {
        this(ALL_FIELDS, position, velocity, acceleration, rotation, angularVelocity);
    }

    public static TerseMotion positionAndRotation(Vector3 position, Quaternion rotation)
    {
        return new TerseMotion(POSITION_ROTATION, position, Vector3.ZERO, Vector3.ZERO,
                rotation, Vector3.ZERO);
    }

    public boolean has(Field field)
    {
        return present.contains(field);
    }

    public static int bits(UpdateKind kind, Set<Field> fields)
    {
        int bits = 0;
        if (fields.contains(Field.POSITION)) {
            bits += kind.position().bits();
        }
        if (fields.contains(Field.VELOCITY)) {
            bits += UpdateKind.VELOCITY.bits();
        }
        if (fields.contains(Field.ACCELERATION)) {
            bits += UpdateKind.ACCELERATION.bits();
        }
        if (fields.contains(Field.ROTATION)) {
            bits += RotationPacking.BITS;
        }
        if (fields.contains(Field.ANGULAR_VELOCITY)) {
            bits += UpdateKind.ANGULAR_VELOCITY.bits();
        }
        return bits;
    }

    /**
     * @param fields the fields present in the block
     * @throws BitBufferUnderflowException if the block is truncated
     */
    public static TerseMotion decode(byte[] buffer, int bitOffset, UpdateKind kind, Set<Field> fields)
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fields, "fields");
        BitReader in = new BitReader(buffer, bitOffset);

        Vector3 position = fields.contains(Field.POSITION) ? kind.position().read(in) : Vector3.ZERO;
        Vector3 velocity = fields.contains(Field.VELOCITY) ? UpdateKind.VELOCITY.read(in) : Vector3.ZERO;
        Vector3 acceleration = fields.contains(Field.ACCELERATION)
                ? UpdateKind.ACCELERATION.read(in) : Vector3.ZERO;
        Quaternion rotation = fields.contains(Field.ROTATION)
                ? RotationPacking.unpack(in) : Quaternion.IDENTITY;
        Vector3 angular = fields.contains(Field.ANGULAR_VELOCITY)
                ? UpdateKind.ANGULAR_VELOCITY.read(in) : Vector3.ZERO;

        return new TerseMotion(fields, position, velocity, acceleration, rotation, angular);
    }

    /**
     * Write the present fields only.
     */
    public byte[] encode(UpdateKind kind)
    {
        BitWriter out = new BitWriter((bits(kind, present) + 7) / 8);
        if (has(Field.POSITION)) {
            kind.position().write(out, position);
        }
        if (has(Field.VELOCITY)) {
            UpdateKind.VELOCITY.write(out, velocity);
        }
        if (has(Field.ACCELERATION)) {
            UpdateKind.ACCELERATION.write(out, acceleration);
        }
        if (has(Field.ROTATION)) {
            RotationPacking.pack(out, rotation);
        }
        if (has(Field.ANGULAR_VELOCITY)) {
            UpdateKind.ANGULAR_VELOCITY.write(out, angularVelocity);
        }
        return out.toByteArray();
    }
}
