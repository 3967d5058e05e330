package com.questrail.gridlink.protocol.lludp.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * CircuitTimingPolicy
 * -----------------------------------------------------------------------------
 * Reliability and handshake tuning for every circuit.
 *
 * <p>These are tuning constants, not protocol law. The grid server does not
 * publish its own timing expectations, so the defaults are conservative and
 * everything here can be overridden.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>resendInterval</b>: age after which an unacknowledged reliable
 *       packet is resent.</li>
 *   <li><b>resendCheckInterval</b>: how often outstanding packets are scanned.</li>
 *   <li><b>maxResendCount</b>: resends before a packet is reported as a
 *       delivery failure.</li>
 *   <li><b>ackFlushInterval</b>: longest time an owed ack waits for outbound
 *       traffic to ride on before a standalone PacketAck is sent.</li>
 *   <li><b>maxPiggybackedAcks</b>: acks appended to a single outbound packet
 *       (1 to 255).</li>
 *   <li><b>seenWindowSize</b>: inbound sequence numbers remembered for
 *       duplicate suppression.</li>
 *   <li><b>handshakeTimeout</b>: wait per handshake attempt.</li>
 *   <li><b>maxHandshakeAttempts</b>: sends of the handshake packet before
 *       the connection is reported as failed.</li>
 *   <li><b>logoutTimeout</b>: wait for LogoutReply before circuits are torn
 *       down anyway.</li>
 * </ul>
 */
public record CircuitTimingPolicy(
        Duration resendInterval,
        Duration resendCheckInterval,
        int maxResendCount,
        Duration ackFlushInterval,
        int maxPiggybackedAcks,
        int seenWindowSize,
        Duration handshakeTimeout,
        int maxHandshakeAttempts,
        Duration logoutTimeout
) {
    /**
     * Canonical constructor with validation.
     */
    public CircuitTimingPolicy {
        requirePositive(resendInterval, "resendInterval");
        requirePositive(resendCheckInterval, "resendCheckInterval");
        requirePositive(ackFlushInterval, "ackFlushInterval");
        requirePositive(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(logoutTimeout, "logoutTimeout");
        if (logoutTimeout.isNegative()) {
            throw new IllegalArgumentException("logoutTimeout must be non-negative");
        }

        if (maxResendCount < 0) {
            throw new IllegalArgumentException("maxResendCount must be non-negative");
        }
        if (maxPiggybackedAcks < 0 || maxPiggybackedAcks > 255) {
            throw new IllegalArgumentException("maxPiggybackedAcks must be 0..255");
        }
        if (seenWindowSize < 1) {
            throw new IllegalArgumentException("seenWindowSize must be positive");
        }
        if (maxHandshakeAttempts < 1) {
            throw new IllegalArgumentException("maxHandshakeAttempts must be at least 1");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>resendInterval: 4000ms</li>
     *   <li>resendCheckInterval: 500ms</li>
     *   <li>maxResendCount: 3</li>
     *   <li>ackFlushInterval: 100ms</li>
     *   <li>maxPiggybackedAcks: 10</li>
     *   <li>seenWindowSize: 1024</li>
     *   <li>handshakeTimeout: 5000ms</li>
     *   <li>maxHandshakeAttempts: 3</li>
     *   <li>logoutTimeout: 5000ms</li>
     * </ul>
     */
    public static CircuitTimingPolicy defaults() {
        return new CircuitTimingPolicy(
                Duration.ofMillis(4000),
                Duration.ofMillis(500),
                3,
                Duration.ofMillis(100),
                10,
                1024,
                Duration.ofMillis(5000),
                3,
                Duration.ofMillis(5000)
        );
    }

    public CircuitTimingPolicy withResend(Duration interval, Duration checkInterval, int maxResends) {
        return new CircuitTimingPolicy(interval, checkInterval, maxResends, ackFlushInterval,
                maxPiggybackedAcks, seenWindowSize, handshakeTimeout, maxHandshakeAttempts, logoutTimeout);
    }

    public CircuitTimingPolicy withHandshake(Duration timeout, int maxAttempts) {
        return new CircuitTimingPolicy(resendInterval, resendCheckInterval, maxResendCount, ackFlushInterval,
                maxPiggybackedAcks, seenWindowSize, timeout, maxAttempts, logoutTimeout);
    }

    public CircuitTimingPolicy withAcks(Duration flushInterval, int maxPiggybacked) {
        return new CircuitTimingPolicy(resendInterval, resendCheckInterval, maxResendCount, flushInterval,
                maxPiggybacked, seenWindowSize, handshakeTimeout, maxHandshakeAttempts, logoutTimeout);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
