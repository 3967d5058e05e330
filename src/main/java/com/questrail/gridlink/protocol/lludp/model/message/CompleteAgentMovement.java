package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.Objects;
import java.util.UUID;

/**
 * Tells the region the agent is ready to be placed in the world.
 */
public record CompleteAgentMovement(UUID agentId, UUID sessionId, long circuitCode)
{
    public CompleteAgentMovement {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public byte[] toBody()
    {
        return new BodyWriter()
                .writeUuid(agentId)
                .writeUuid(sessionId)
                .writeU32(circuitCode)
                .toByteArray();
    }

    public static CompleteAgentMovement fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        return new CompleteAgentMovement(r.readUuid(), r.readUuid(), r.readU32());
    }
}
