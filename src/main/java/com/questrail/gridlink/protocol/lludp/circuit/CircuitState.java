package com.questrail.gridlink.protocol.lludp.circuit;

/**
 * Handshake state of a circuit.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → AWAITING_HANDSHAKE_CONFIRM → ACTIVE → DISCONNECTING → DISCONNECTED
 * </pre>
 *
 * Any non-terminal state may fall to DISCONNECTING on failure.
 */
public enum CircuitState
{
    DISCONNECTED,

    /** Socket bind in progress. */
    CONNECTING,

    /** Opening packet sent; waiting for the region to complete the handshake. */
    AWAITING_HANDSHAKE_CONFIRM,

    /** Full two-way traffic. */
    ACTIVE,

    /** Teardown in progress; nothing is dispatched any more. */
    DISCONNECTING
}
