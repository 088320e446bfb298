package com.questrail.costsource.transport.local.netty;

import com.questrail.costsource.transport.FrameEndpointListener;
import com.questrail.costsource.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyLocalEndpointSupport
 * -----------------------------------------------------------------------------
 * Pipeline, listener plumbing and lifecycle shared by the client and server
 * in-VM endpoints.
 *
 * <p>Each frame is prefixed with a 4-byte length on the way out and reassembled
 * on the way in, bounded by {@code maxFrameBytes}.</p>
 */
abstract class NettyLocalEndpointSupport
{
    private static final Logger log = LoggerFactory.getLogger(NettyLocalEndpointSupport.class);

    static final long START_TIMEOUT_SECONDS = 5;

    protected final String channelId;
    protected final int maxFrameBytes;
    protected final EventLoopGroup group;

    private volatile FrameEndpointListener listener;

    protected NettyLocalEndpointSupport(String channelId, int maxFrameBytes, EventLoopGroup group)
    {
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
        this.group = Objects.requireNonNull(group, "group");
    }

    public void setListener(FrameEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    protected FrameEndpointListener listener()
    {
        return listener;
    }

    protected FrameEndpointListener requireListener()
    {
        FrameEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("FrameEndpointListener must be set before start()");
        }
        return l;
    }

    protected void installPipeline(ChannelPipeline p)
    {
        p.addLast(new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(new InboundHandler());
    }

    /**
     * Waits for a bind/connect future; on failure the listener is told and the
     * event loop group is released before the exception is raised.
     */
    protected Channel awaitActivation(ChannelFuture future, String action)
    {
        FrameEndpointListener l = requireListener();

        boolean done = future.awaitUninterruptibly(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!done || !future.isSuccess()) {
            Throwable cause = done
                    ? future.cause()
                    : new TransportException(action + " timed out after " + START_TIMEOUT_SECONDS + "s");
            l.onTransportDown(cause);
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new TransportException("failed to " + action + " local channel '" + channelId + "'", cause);
        }
        return future.channel();
    }

    protected void write(Channel ch, byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (ch == null || !ch.isActive()) {
            throw new TransportException("local channel '" + channelId + "' has no connected peer");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(frame);
        ch.writeAndFlush(buf).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.debug("Write on local channel '{}' failed", channelId, f.cause());
            }
        });
    }

    protected void shutdown(Channel ch)
    {
        if (ch != null) {
            ch.close().awaitUninterruptibly(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /** Hook for the server to track its accepted peer. */
    protected void onPeerActive(Channel ch)
    {
    }

    /** Hook for the server to forget its accepted peer. */
    protected void onPeerInactive(Channel ch)
    {
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives reassembled frames and forwards raw bytes to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            onPeerActive(ctx.channel());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            FrameEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onFrame(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            onPeerInactive(ctx.channel());
            FrameEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            FrameEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
