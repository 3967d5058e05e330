package com.questrail.gridlink.protocol.lludp.observability;

import com.questrail.gridlink.protocol.lludp.circuit.CircuitState;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Record representing a circuit state transition.
 *
 * @param cause short description of what triggered the transition
 */
public record CircuitStateTransitionEvent(
    Instant timestamp,
    InetSocketAddress remote,
    long circuitCode,
    CircuitState oldState,
    CircuitState newState,
    String cause
) {
    /**
     * True when the circuit just became usable for application traffic.
     */
    public boolean isActivation() {
        return newState == CircuitState.ACTIVE && oldState != CircuitState.ACTIVE;
    }
}
