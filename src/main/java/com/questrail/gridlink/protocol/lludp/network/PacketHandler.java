package com.questrail.gridlink.protocol.lludp.network;

import com.questrail.gridlink.protocol.lludp.circuit.Circuit;
import com.questrail.gridlink.protocol.lludp.model.Packet;

/**
 * Application callback for one message type.
 *
 * <p>Handlers run on the event loop and must not block; long work should be
 * handed to another executor. A handler may register or unregister handlers
 * from inside its own invocation; the change applies from the next packet.</p>
 */
@FunctionalInterface
public interface PacketHandler
{
    void onPacket(Circuit circuit, Packet packet);
}
