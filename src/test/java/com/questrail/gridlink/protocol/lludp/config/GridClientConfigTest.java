package com.questrail.gridlink.protocol.lludp.config;

import com.questrail.gridlink.protocol.lludp.circuit.CircuitTimingPolicy;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class GridClientConfigTest {

    @Test
    void defaultsBindEphemeralPort() {
        GridClientConfig c = GridClientConfig.defaults();

        assertEquals(0, c.bindAddress().getPort());
        assertEquals(GridClientConfig.DEFAULT_MAX_PACKET_SIZE, c.maxPacketSize());
        assertEquals(CircuitTimingPolicy.defaults(), c.timingPolicy());
    }

    @Test
    void builderOverrides() {
        CircuitTimingPolicy fast = CircuitTimingPolicy.defaults().withHandshake(Duration.ofMillis(250), 2);

        GridClientConfig c = GridClientConfig.builder()
                .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                .withTimingPolicy(fast)
                .withMaxPacketSize(1400)
                .build();

        assertEquals(1400, c.maxPacketSize());
        assertSame(fast, c.timingPolicy());
        assertEquals("127.0.0.1", c.bindAddress().getHostString());
    }

    @Test
    void decodedLimitMustCoverPacketSize() {
        assertThrows(IllegalArgumentException.class,
                () -> GridClientConfig.builder().withMaxPacketSize(9000).build());
        assertThrows(NullPointerException.class,
                () -> GridClientConfig.builder().withBindAddress(null).build());
    }

    @Test
    void sessionRequiresBothIds() {
        assertThrows(NullPointerException.class, () -> new SessionContext(null, UUID.randomUUID()));
        assertThrows(NullPointerException.class, () -> new SessionContext(UUID.randomUUID(), null));
    }
}
