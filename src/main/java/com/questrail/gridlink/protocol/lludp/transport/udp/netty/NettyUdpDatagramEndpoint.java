package com.questrail.gridlink.protocol.lludp.transport.udp.netty;

import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpoint;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.PortUnreachableException;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * packets, track sequences or schedule resends.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; reference-counted buffers are released internally.
 *
 * <h2>Event loop group</h2>
 * Circuits share one {@link EventLoopGroup} owned by the runtime. An endpoint
 * built with {@link #NettyUdpDatagramEndpoint(InetSocketAddress)} owns a
 * private group and shuts it down on {@link #stop()}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the socket asynchronously.
 * - {@link #stop()} closes the channel. The listener sees at most one
 *   {@code onTransportDown} per endpoint.
 * - A write that fails (unresolved or unroutable remote, broken socket)
 *   signals {@code onTransportDown} with the cause.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final Bootstrap bootstrap;

    private final AtomicBoolean downSignalled = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Endpoint with a private single-threaded event loop group.
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, new NioEventLoopGroup(1), true);
    }

    /**
     * Endpoint on a shared event loop group. The group is not shut down by
     * this endpoint.
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, EventLoopGroup group)
    {
        this(bindAddress, group, false);
    }

    private NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, EventLoopGroup group, boolean ownsGroup)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                if (stopped.get()) {
                    future.channel().close();
                    return;
                }
                channel = future.channel();
                log.debug("UDP endpoint bound to {}", future.channel().localAddress());
                l.onTransportUp();
            }
            else {
                log.warn("UDP bind to {} failed", bindAddress, future.cause());
                signalDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        if (ownsGroup) {
            group.shutdownGracefully();
        }

        signalDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || stopped.get()) {
            // Not up (or already closed). The circuit owns retry policy.
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        onSendFailed(remote, future.cause());
                    }
                });
    }

    /**
     * A failed write is a socket-level failure and takes the transport down,
     * except ICMP port-unreachable (left to the circuit's timers) and writes
     * racing {@link #stop()}.
     */
    private void onSendFailed(SocketAddress remote, Throwable cause)
    {
        if (stopped.get()) {
            return;
        }
        if (cause instanceof PortUnreachableException) {
            log.debug("Send to {}: port unreachable", remote);
            return;
        }
        log.warn("UDP send to {} failed", remote, cause);
        signalDown(cause);
    }

    /**
     * Bound local address, once the socket is up.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    private void signalDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && downSignalled.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each {@link DatagramPacket} into a {@code byte[]} and forwards it
     * to the port listener. {@link SimpleChannelInboundHandler} releases the
     * packet.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            signalDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // ICMP port-unreachable surfaces here as PortUnreachableException;
            // the circuit's resend and handshake timers decide whether the peer is gone.
            if (cause instanceof PortUnreachableException) {
                log.debug("Peer port unreachable: {}", cause.getMessage());
                return;
            }
            signalDown(cause);
            ctx.close();
        }
    }
}
