package com.questrail.costsource.transport.local.netty;

import com.questrail.costsource.transport.FrameEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;

/**
 * NettyLocalClientEndpoint
 * =============================================================================
 * Client side of the in-VM {@link FrameEndpoint}. Connects a Netty
 * {@link LocalChannel} to a {@link NettyLocalServerEndpoint} bound under the
 * same channel id.
 *
 * <p>{@link #start()} blocks until the connection is established; it fails
 * with {@link com.questrail.costsource.transport.TransportException} when no
 * server is bound under the id.</p>
 */
public final class NettyLocalClientEndpoint extends NettyLocalEndpointSupport implements FrameEndpoint
{
    private final Bootstrap bootstrap;

    private volatile Channel channel;

    public NettyLocalClientEndpoint(String channelId, int maxFrameBytes)
    {
        super(channelId, maxFrameBytes, new DefaultEventLoopGroup(1));

        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(LocalChannel.class)
                .handler(new ChannelInitializer<LocalChannel>() {
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
        channel = awaitActivation(bootstrap.connect(new LocalAddress(channelId)), "connect");
        requireListener().onTransportUp();
    }

    @Override
    public void stop()
    {
        shutdown(channel);
    }

    @Override
    public void send(byte[] frame)
    {
        write(channel, frame);
    }
}
