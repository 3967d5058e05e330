package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.Objects;
import java.util.UUID;

/**
 * Opening packet of a circuit: presents the circuit code issued at login
 * together with the session and agent identifiers.
 */
public record UseCircuitCode(long circuitCode, UUID sessionId, UUID agentId)
{
    public UseCircuitCode {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(agentId, "agentId");
    }

    public byte[] toBody()
    {
        return new BodyWriter()
                .writeU32(circuitCode)
                .writeUuid(sessionId)
                .writeUuid(agentId)
                .toByteArray();
    }

    public static UseCircuitCode fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        return new UseCircuitCode(r.readU32(), r.readUuid(), r.readUuid());
    }
}
