package com.questrail.gridlink.protocol.lludp.runtime;

import com.questrail.gridlink.protocol.lludp.circuit.CircuitEnvironment;
import com.questrail.gridlink.protocol.lludp.codec.impl.DefaultPacketDecoder;
import com.questrail.gridlink.protocol.lludp.codec.impl.DefaultPacketEncoder;
import com.questrail.gridlink.protocol.lludp.config.GridClientConfig;
import com.questrail.gridlink.protocol.lludp.config.SessionContext;
import com.questrail.gridlink.protocol.lludp.internal.time.MonotonicClock;
import com.questrail.gridlink.protocol.lludp.internal.time.ScheduledExecutorScheduler;
import com.questrail.gridlink.protocol.lludp.internal.time.SystemMonotonicClock;
import com.questrail.gridlink.protocol.lludp.internal.time.SystemWallClock;
import com.questrail.gridlink.protocol.lludp.network.NetworkManager;
import com.questrail.gridlink.protocol.lludp.observability.LludpObservabilitySink;
import com.questrail.gridlink.protocol.lludp.observability.Slf4jLludpObservabilitySink;
import com.questrail.gridlink.protocol.lludp.transport.udp.netty.NettyDatagramEndpointFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * GridClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production transport stack.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>One single-threaded scheduled executor, "gridlink-loop", is the event
 *       loop: it runs every timer and every inbound datagram.</li>
 *   <li>One Netty {@link NioEventLoopGroup} performs socket I/O for all
 *       circuits and hands datagrams to the loop.</li>
 * </ul>
 */
public final class GridClientRuntime {
    private final NetworkManager network;
    private final ScheduledExecutorService loopExecutor;
    private final EventLoopGroup ioGroup;

    private GridClientRuntime(NetworkManager network, ScheduledExecutorService loopExecutor, EventLoopGroup ioGroup) {
        this.network = network;
        this.loopExecutor = loopExecutor;
        this.ioGroup = ioGroup;
    }

    public NetworkManager network() {
        return network;
    }

    /**
     * Close every circuit (sending CloseCircuit), then release threads.
     */
    public void stop() {
        try {
            loopExecutor.submit(network::shutdown).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            // Fall through to forced shutdown; circuits die with their sockets.
            network.shutdown();
        }

        loopExecutor.shutdown();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GridClientConfig config = GridClientConfig.defaults();
        private SessionContext session;
        private LludpObservabilitySink observabilitySink = new Slf4jLludpObservabilitySink();
        private int ioThreads = 1;

        public Builder withConfig(GridClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSession(SessionContext session) {
            this.session = session;
            return this;
        }

        public Builder withObservabilitySink(LludpObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withIoThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        public GridClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(session, "session");

            // 1. Event loop and time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "gridlink-loop");
                t.setDaemon(true);
                return t;
            });

            // 2. Shared socket I/O
            EventLoopGroup ioGroup = new NioEventLoopGroup(ioThreads);

            // 3. Circuit collaborators
            CircuitEnvironment env = new CircuitEnvironment(
                new DefaultPacketDecoder(config.maxDecodedPacketSize()),
                new DefaultPacketEncoder(),
                config.timingPolicy(),
                config.maxPacketSize(),
                clock,
                new ScheduledExecutorScheduler(loop, clock),
                loop,
                SystemWallClock.INSTANCE,
                observabilitySink
            );

            // 4. Network manager
            NetworkManager network = new NetworkManager(
                session,
                env,
                new NettyDatagramEndpointFactory(ioGroup),
                config.bindAddress()
            );

            return new GridClientRuntime(network, loop, ioGroup);
        }
    }
}
