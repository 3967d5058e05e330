package com.questrail.gridlink.protocol.lludp.config;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the logged-in session, as issued by the login service.
 *
 * <p>Passed explicitly to the network manager and every circuit it opens;
 * there is no process-wide current session.</p>
 */
public record SessionContext(UUID agentId, UUID sessionId)
{
    public SessionContext {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(sessionId, "sessionId");
    }
}
