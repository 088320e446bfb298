package com.questrail.costsource.harness;

import com.questrail.costsource.transport.FrameEndpoint;
import com.questrail.costsource.transport.local.netty.NettyLocalClientEndpoint;
import com.questrail.costsource.transport.local.netty.NettyLocalServerEndpoint;

/**
 * Creates the two ends of the in-memory channel for one harness binding.
 */
public interface EndpointFactory
{
    FrameEndpoint server(String channelId, int maxFrameBytes);

    FrameEndpoint client(String channelId, int maxFrameBytes);

    /**
     * Netty in-VM channels; no sockets are opened.
     */
    static EndpointFactory nettyLocal()
    {
        return new EndpointFactory() {
            @Override
            public FrameEndpoint server(String channelId, int maxFrameBytes)
            {
                return new NettyLocalServerEndpoint(channelId, maxFrameBytes);
            }

            @Override
            public FrameEndpoint client(String channelId, int maxFrameBytes)
            {
                return new NettyLocalClientEndpoint(channelId, maxFrameBytes);
            }
        };
    }
}
