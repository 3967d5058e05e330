package com.questrail.gridlink.protocol.lludp.circuit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class CircuitTimingPolicyTest {

    @Test
    void defaultsMatchRegionExpectations() {
        CircuitTimingPolicy p = CircuitTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(4000), p.resendInterval());
        assertEquals(Duration.ofMillis(500), p.resendCheckInterval());
        assertEquals(3, p.maxResendCount());
        assertEquals(Duration.ofMillis(100), p.ackFlushInterval());
        assertEquals(10, p.maxPiggybackedAcks());
        assertEquals(1024, p.seenWindowSize());
        assertEquals(Duration.ofMillis(5000), p.handshakeTimeout());
        assertEquals(3, p.maxHandshakeAttempts());
        assertEquals(Duration.ofMillis(5000), p.logoutTimeout());
    }

    @Test
    void withersReplaceOnlyTheirGroup() {
        CircuitTimingPolicy p = CircuitTimingPolicy.defaults()
                .withAcks(Duration.ofMillis(50), 0)
                .withHandshake(Duration.ofSeconds(1), 5);

        assertEquals(Duration.ofMillis(50), p.ackFlushInterval());
        assertEquals(0, p.maxPiggybackedAcks());
        assertEquals(5, p.maxHandshakeAttempts());
        assertEquals(Duration.ofMillis(4000), p.resendInterval());
    }

    @Test
    void invalidValuesAreRejected() {
        CircuitTimingPolicy d = CircuitTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withResend(Duration.ZERO, Duration.ofMillis(1), 3));
        assertThrows(IllegalArgumentException.class, () -> d.withResend(Duration.ofMillis(1), Duration.ofMillis(1), -1));
        assertThrows(IllegalArgumentException.class, () -> d.withAcks(Duration.ofMillis(100), 256));
        assertThrows(IllegalArgumentException.class, () -> d.withHandshake(Duration.ofMillis(100), 0));
        assertThrows(NullPointerException.class, () -> d.withHandshake(null, 3));
    }
}
