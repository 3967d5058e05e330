package com.questrail.gridlink.protocol.lludp.network;

import com.questrail.gridlink.protocol.lludp.circuit.Circuit;
import com.questrail.gridlink.protocol.lludp.circuit.DisconnectReason;
import com.questrail.gridlink.protocol.lludp.model.MessageType;

/**
 * Circuit lifecycle notifications for collaborators. All methods default to
 * no-ops so listeners implement only what they need.
 */
public interface NetworkEventListener
{
    /** A circuit completed its handshake. */
    default void onCircuitConnected(Circuit circuit) {}

    /** An active circuit was torn down. */
    default void onCircuitDisconnected(Circuit circuit, DisconnectReason reason) {}

    /** A circuit never became active. */
    default void onConnectionFailed(Circuit circuit, DisconnectReason reason) {}

    /** The current circuit went away: the agent no longer has a region. */
    default void onSessionDisconnected(Circuit circuit, DisconnectReason reason) {}

    /** A reliable packet exhausted its resends. */
    default void onDeliveryFailed(Circuit circuit, MessageType type, long sequence) {}

    /**
     * Logout finished and every circuit is closed.
     *
     * @param confirmed whether the region answered with LogoutReply
     */
    default void onLoggedOut(boolean confirmed) {}
}
