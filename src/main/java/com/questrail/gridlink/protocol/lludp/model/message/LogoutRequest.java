package com.questrail.gridlink.protocol.lludp.model.message;

import java.util.Objects;
import java.util.UUID;

public record LogoutRequest(UUID agentId, UUID sessionId)
{
    public LogoutRequest {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public byte[] toBody()
    {
        return new BodyWriter()
                .writeUuid(agentId)
                .writeUuid(sessionId)
                .toByteArray();
    }

    public static LogoutRequest fromBody(byte[] body)
    {
        BodyReader r = new BodyReader(body);
        return new LogoutRequest(r.readUuid(), r.readUuid());
    }
}
