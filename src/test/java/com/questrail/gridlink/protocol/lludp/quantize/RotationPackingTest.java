package com.questrail.gridlink.protocol.lludp.quantize;

import com.questrail.gridlink.math.Quaternion;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class RotationPackingTest
{
    private static final double COMPONENT_TOLERANCE = 2.0 / 0xFFFF * 4;

    @Test
    void wIsReconstructedFromUnitNorm()
    {
        Quaternion q = RotationPacking.reconstruct(0.5, 0.5, 0.0);

        assertEquals(Math.sqrt(0.5), q.w(), 1e-9);
        assertEquals(1.0, q.norm(), 1e-9);
    }

    @Test
    void reEncodingStaysWithinOneStep()
    {
        Quaternion q = RotationPacking.reconstruct(0.5, 0.5, 0.0);
        double step = UpdateKind.ROTATION_COMPONENT.step();

        Quaternion back = RotationPacking.unpack(RotationPacking.pack(q), 0);

        assertEquals(q.x(), back.x(), step);
        assertEquals(q.y(), back.y(), step);
        assertEquals(q.z(), back.z(), step);
        assertEquals(q.w(), back.w(), 1e-4);
    }

    @Test
    void overflowingComponentsAreRenormalized()
    {
        Quaternion q = RotationPacking.reconstruct(1.0, 1.0, 0.0);

        assertEquals(0.0, q.w(), 1e-9);
        assertEquals(Math.sqrt(0.5), q.x(), 1e-9);
        assertEquals(1.0, q.norm(), 1e-9);
    }

    @Test
    void packedFormIsSixBytes()
    {
        assertEquals(6, RotationPacking.pack(Quaternion.IDENTITY).length);
        assertEquals(48, RotationPacking.BITS);
    }

    @Test
    void negativeWIsFlippedToTheSameRotation()
    {
        Quaternion q = new Quaternion(0.1, -0.2, 0.3, -0.9).normalized();

        Quaternion back = RotationPacking.unpack(RotationPacking.pack(q), 0);

        // q and -q describe the same rotation.
        assertEquals(1.0, Math.abs(back.dot(q)), 1e-3);
        assertTrue(back.w() >= 0);
    }

    @Test
    void randomRotationsSurvivePacking()
    {
        Random rnd = new Random(42);
        for (int i = 0; i < 500; i++) {
            Quaternion q = new Quaternion(rnd.nextGaussian(), rnd.nextGaussian(), rnd.nextGaussian(),
                    Math.abs(rnd.nextGaussian()) + 0.2).normalized();

            Quaternion back = RotationPacking.unpack(RotationPacking.pack(q), 0);

            assertEquals(q.x(), back.x(), COMPONENT_TOLERANCE);
            assertEquals(q.y(), back.y(), COMPONENT_TOLERANCE);
            assertEquals(q.z(), back.z(), COMPONENT_TOLERANCE);
            assertEquals(1.0, back.norm(), 1e-9);
        }
    }

    @Test
    void unpackHonoursBitOffset()
    {
        BitWriter w = new BitWriter().writeBits(5, 0b10101);
        Quaternion q = new Quaternion(0.0, 0.0, Math.sqrt(0.5), Math.sqrt(0.5));
        RotationPacking.pack(w, q);

        Quaternion back = RotationPacking.unpack(w.toByteArray(), 5);

        assertEquals(q.z(), back.z(), COMPONENT_TOLERANCE);
        assertEquals(q.w(), back.w(), 1e-3);
    }
}
