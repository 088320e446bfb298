package com.questrail.costsource.transport;

/**
 * FrameEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link FrameEndpoint}.
 *
 * <p>Callbacks are delivered serially per endpoint. Netty endpoints deliver
 * them on the channel's event loop, so listeners must not block; long-running
 * work is handed off to another executor.</p>
 */
public interface FrameEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a complete frame is received.
     *
     * <p>The payload is a plain copy; framework buffers have already been
     * released.</p>
     */
    void onFrame(byte[] frame);
}
