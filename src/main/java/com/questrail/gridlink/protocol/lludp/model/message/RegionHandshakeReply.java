package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.Objects;
import java.util.UUID;

/**
 * Reply to the region's RegionHandshake.
 */
public record RegionHandshakeReply(UUID agentId, UUID sessionId, long flags)
{
    /**
     * Flags a viewer normally sends: supports self-appearance, vocal chat and
     * parcel property updates.
     */
    public static final long DEFAULT_FLAGS = 0x7L;

    public RegionHandshakeReply {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public byte[] toBody()
    {
        return new BodyWriter()
                .writeUuid(agentId)
                .writeUuid(sessionId)
                .writeU32(flags)
                .toByteArray();
    }

    public static RegionHandshakeReply fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        return new RegionHandshakeReply(r.readUuid(), r.readUuid(), r.readU32());
    }
}
