package com.questrail.gridlink.protocol.lludp.transport.udp.netty;

import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpoint;
import com.questrail.gridlink.protocol.lludp.transport.DatagramEndpointFactory;

import io.netty.channel.EventLoopGroup;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Builds {@link NettyUdpDatagramEndpoint}s on one shared event loop group.
 */
public final class NettyDatagramEndpointFactory implements DatagramEndpointFactory
{
    private final EventLoopGroup group;

    public NettyDatagramEndpointFactory(EventLoopGroup group)
    {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public DatagramEndpoint create(InetSocketAddress bindAddress)
    {
        return new NettyUdpDatagramEndpoint(bindAddress, group);
    }
}
