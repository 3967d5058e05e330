package com.questrail.gridlink.protocol.lludp.circuit;

import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.Packet;

/**
 * Upward notifications from a circuit to its owner. Calls are made outside
 * the circuit's lock, on the thread that drove the change.
 */
public interface CircuitListener
{
    /**
     * A decoded, non-duplicate packet for application handlers.
     */
    void onPacket(Circuit circuit, Packet packet);

    /**
     * The handshake completed.
     */
    void onActive(Circuit circuit);

    /**
     * The circuit reached DISCONNECTED. Called exactly once.
     *
     * @param wasActive {@code false} means the connection attempt failed
     */
    void onClosed(Circuit circuit, DisconnectReason reason, boolean wasActive);

    /**
     * A reliable packet exhausted its resends. Not fatal unless it was
     * driving the handshake, in which case {@link #onClosed} follows instead.
     */
    void onDeliveryFailed(Circuit circuit, MessageType type, long sequence);
}
