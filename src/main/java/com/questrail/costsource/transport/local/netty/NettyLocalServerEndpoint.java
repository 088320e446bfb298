package com.questrail.costsource.transport.local.netty;

import com.questrail.costsource.transport.FrameEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.local.LocalServerChannel;

import java.util.concurrent.TimeUnit;

/**
 * NettyLocalServerEndpoint
 * =============================================================================
 * Server side of the in-VM {@link FrameEndpoint}, backed by Netty's
 * {@link LocalServerChannel}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * the RPC envelope, dispatch calls or apply deadlines.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. The channel is addressed by a plain string id.
 *
 * <h2>Peer model</h2>
 * The endpoint serves a single peer: {@link #send(byte[])} writes to the most
 * recently accepted client channel.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the local address and blocks until bound.
 * - {@link #stop()} closes the server and peer channels and shuts down the
 *   event loop group.
 */
public final class NettyLocalServerEndpoint extends NettyLocalEndpointSupport implements FrameEndpoint
{
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;
    private volatile Channel peer;

    public NettyLocalServerEndpoint(String channelId, int maxFrameBytes)
    {
        super(channelId, maxFrameBytes, new DefaultEventLoopGroup(1));

        this.bootstrap = new ServerBootstrap()
                .group(group)
                .channel(LocalServerChannel.class)
                .childHandler(new ChannelInitializer<LocalChannel>() {
                    @Override
                    protected void initChannel(LocalChannel ch)
                    {
                        installPipeline(ch.pipeline());
                    }
                });
    }

    @Override
    public void start()
    {
        serverChannel = awaitActivation(bootstrap.bind(new LocalAddress(channelId)), "bind");
        requireListener().onTransportUp();
    }

    @Override
    public void stop()
    {
        Channel p = peer;
        if (p != null) {
            p.close().awaitUninterruptibly(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        shutdown(serverChannel);
    }

    @Override
    public void send(byte[] frame)
    {
        write(peer, frame);
    }

    @Override
    protected void onPeerActive(Channel ch)
    {
        peer = ch;
    }

    @Override
    protected void onPeerInactive(Channel ch)
    {
        if (peer == ch) {
            peer = null;
        }
    }
}
