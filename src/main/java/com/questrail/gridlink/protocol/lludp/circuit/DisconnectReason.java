package com.questrail.gridlink.protocol.lludp.circuit;

/**
 * Why a circuit was torn down.
 */
public enum DisconnectReason
{
    /** Explicit disconnect by a collaborator. */
    REQUESTED(true),

    /** Session logout. */
    LOGOUT(true),

    /** No handshake confirmation after the last attempt. */
    HANDSHAKE_TIMEOUT(true),

    /** The packet driving the handshake exhausted its resends. */
    HANDSHAKE_DELIVERY_FAILED(true),

    /** Bind, send or receive failure on the socket. */
    TRANSPORT_FAILURE(false),

    /** The region sent CloseCircuit. */
    REMOTE_CLOSED(false),

    /** Runtime shutdown. */
    SHUTDOWN(true);

    private final boolean notifiesPeer;

    DisconnectReason(boolean notifiesPeer)
    {
        this.notifiesPeer = notifiesPeer;
    }

    /**
     * Whether a CloseCircuit is sent to the region on teardown.
     */
    public boolean notifiesPeer()
    {
        return notifiesPeer;
    }
}
