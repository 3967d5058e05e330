package com.questrail.gridlink.protocol.lludp.circuit;

import java.util.Objects;

/**
 * Result of submitting an outbound packet. Submission never blocks and never
 * throws for protocol reasons.
 */
public sealed interface SendOutcome permits SendOutcome.Sent, SendOutcome.Rejected
{
    /**
     * Handed to the socket with the given sequence number. Reliable packets
     * are now tracked for resend.
     */
    record Sent(long sequence) implements SendOutcome {}

    record Rejected(Reason reason) implements SendOutcome
    {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }
    }

    enum Reason
    {
        /** Circuit has not finished its handshake. */
        NOT_READY,
        /** Circuit is disconnecting or disconnected. */
        CLOSED,
        /** Encoded datagram exceeds the maximum packet size. */
        TOO_LARGE,
        /** Agent-movement traffic submitted to a child circuit. */
        NOT_CURRENT_CIRCUIT,
        /** Circuit is not owned by this network manager. */
        UNKNOWN_CIRCUIT
    }

    default boolean isSent()
    {
        return this instanceof Sent;
    }

    static SendOutcome rejected(Reason reason)
    {
        return new Rejected(reason);
    }
}
