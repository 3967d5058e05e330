package com.questrail.gridlink.protocol.lludp.runtime;

import com.questrail.gridlink.protocol.lludp.circuit.Circuit;
import com.questrail.gridlink.protocol.lludp.circuit.DisconnectReason;
import com.questrail.gridlink.protocol.lludp.codec.PacketDecodeResult;
import com.questrail.gridlink.protocol.lludp.codec.impl.DefaultPacketDecoder;
import com.questrail.gridlink.protocol.lludp.codec.impl.DefaultPacketEncoder;
import com.questrail.gridlink.protocol.lludp.config.GridClientConfig;
import com.questrail.gridlink.protocol.lludp.config.SessionContext;
import com.questrail.gridlink.protocol.lludp.model.MessageType;
import com.questrail.gridlink.protocol.lludp.model.OutboundPacket;
import com.questrail.gridlink.protocol.lludp.model.Packet;
import com.questrail.gridlink.protocol.lludp.model.PacketHeader;
import com.questrail.gridlink.protocol.lludp.model.message.UseCircuitCode;
import com.questrail.gridlink.protocol.lludp.network.NetworkEventListener;
import com.questrail.gridlink.protocol.lludp.observability.RecordingObservabilitySink;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpointListener;
import com.questrail.gridlink.protocol.lludp.transport.udp.netty.NettyUdpDatagramEndpoint;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GridClientRuntimeIntegrationTest
 * -----------------------------------------------------------------------------
 * Full production stack (Netty sockets, scheduled event loop, real clock)
 * against a minimal region on the loopback interface.
 *
 * <p>The region answers UseCircuitCode with RegionHandshake,
 * CompleteAgentMovement with AgentMovementComplete, and echoes each
 * ChatFromViewer back as ChatFromSimulator. It acknowledges nothing, so the
 * client's appended acks and resends are exercised too.</p>
 */
final class GridClientRuntimeIntegrationTest {

    private static final long CIRCUIT_CODE = 424242L;
    private static final SessionContext SESSION = new SessionContext(UUID.randomUUID(), UUID.randomUUID());

    private EventLoopGroup regionGroup;
    private NettyUdpDatagramEndpoint regionSocket;
    private InetSocketAddress regionAddress;
    private final BlockingQueue<Packet> regionInbox = new LinkedBlockingQueue<>();

    private GridClientRuntime runtime;
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @BeforeEach
    void setUp() throws Exception {
        regionGroup = new NioEventLoopGroup(1);
        regionSocket = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0), regionGroup);
        CountDownLatch up = new CountDownLatch(1);
        regionSocket.setListener(new MiniRegion(up));
        regionSocket.start();
        assertTrue(up.await(5, TimeUnit.SECONDS), "region socket did not bind");
        regionAddress = regionSocket.localAddress().orElseThrow();

        runtime = GridClientRuntime.builder()
                .withConfig(GridClientConfig.builder()
                        .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                        .build())
                .withSession(SESSION)
                .withObservabilitySink(sink)
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        runtime.stop();
        regionSocket.stop();
        regionGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).await(5, TimeUnit.SECONDS);
    }

    @Test
    void connectChatAndDisconnectOverRealSockets() throws Exception {
        CountDownLatch connected = new CountDownLatch(1);
        CountDownLatch disconnected = new CountDownLatch(1);
        runtime.network().addEventListener(new NetworkEventListener() {
            @Override
            public void onCircuitConnected(Circuit circuit) {
                connected.countDown();
            }

            @Override
            public void onCircuitDisconnected(Circuit circuit, DisconnectReason reason) {
                disconnected.countDown();
            }
        });
        BlockingQueue<Packet> echoes = new LinkedBlockingQueue<>();
        runtime.network().registerHandler(MessageType.ChatFromSimulator, (c, p) -> echoes.add(p));

        Circuit circuit = runtime.network().connect(regionAddress, CIRCUIT_CODE);

        assertTrue(connected.await(5, TimeUnit.SECONDS), "circuit did not become active");
        assertTrue(circuit.isActive());
        assertTrue(circuit.isAgentCircuit());

        Packet ucc = awaitRegionPacket(MessageType.UseCircuitCode);
        assertEquals(CIRCUIT_CODE, UseCircuitCode.fromBody(ucc.body()).circuitCode());

        assertTrue(runtime.network()
                .send(OutboundPacket.reliable(MessageType.ChatFromViewer, new byte[]{'h', 'i'}))
                .isSent());

        Packet echo = echoes.poll(5, TimeUnit.SECONDS);
        assertNotNull(echo, "no echo from region");
        assertArrayEquals(new byte[]{'h', 'i'}, echo.body());

        runtime.network().disconnect(circuit, DisconnectReason.REQUESTED);

        assertTrue(disconnected.await(5, TimeUnit.SECONDS));
        awaitRegionPacket(MessageType.CloseCircuit);
        assertTrue(runtime.network().circuits().isEmpty());
        assertTrue(sink.getStateTransitions().stream().anyMatch(e -> e.isActivation()));
    }

    private Packet awaitRegionPacket(MessageType type) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Packet p = regionInbox.poll(100, TimeUnit.MILLISECONDS);
            if (p != null && p.type() == type) {
                return p;
            }
        }
        fail("region never received " + type);
        return null;
    }

    /**
     * Region side of the conversation. Runs on the region's Netty thread.
     */
    private final class MiniRegion implements DatagramEndpointListener {
        private final CountDownLatch up;
        private final DefaultPacketDecoder decoder = new DefaultPacketDecoder();
        private final DefaultPacketEncoder encoder = new DefaultPacketEncoder();
        private final AtomicLong sequence = new AtomicLong(1);

        MiniRegion(CountDownLatch up) {
            this.up = up;
        }

        @Override
        public void onTransportUp() {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            // Region socket closes at teardown only.
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            PacketDecodeResult r = decoder.decode(payload);
            if (!(r instanceof PacketDecodeResult.Decoded d)) {
                return;
            }
            Packet p = d.packet();
            if (p.header().resent()) {
                return;
            }
            regionInbox.add(p);

            switch (p.type()) {
                case UseCircuitCode -> reply(remote, MessageType.RegionHandshake, new byte[0], List.of());
                case CompleteAgentMovement -> reply(remote, MessageType.AgentMovementComplete, new byte[0],
                        List.of(p.sequence()));
                case ChatFromViewer -> reply(remote, MessageType.ChatFromSimulator, p.body(),
                        List.of(p.sequence()));
                default -> { }
            }
        }

        private void reply(SocketAddress to, MessageType type, byte[] body, List<Long> acks) {
            byte[] bytes = encoder.encode(PacketHeader.outbound(true, false, sequence.getAndIncrement()), type, body);
            regionSocket.send(to, acks.isEmpty() ? bytes : encoder.appendAcks(bytes, acks));
        }
    }
}
