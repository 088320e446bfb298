package com.questrail.costsource.transport;

/**
 * FrameEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a point-to-point, message-framed transport.
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>encoding and decoding the RPC envelope carried in each frame</li>
 *   <li>correlating requests with responses</li>
 *   <li>deadlines, cancellation and status mapping</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty's in-VM transport or a test fake.</p>
 */
public interface FrameEndpoint
{
    /**
     * Start the endpoint and block until it is usable.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link FrameEndpointListener#onTransportUp()} exactly once per transition.
     * On failure the listener is told via
     * {@link FrameEndpointListener#onTransportDown(Throwable)} and a
     * {@link TransportException} is thrown.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link FrameEndpointListener#onTransportDown(Throwable)} at most once per
     * transition.</p>
     */
    void stop();

    /**
     * Send one frame to the peer.
     *
     * <p>The frame is delivered to the peer's listener as a single unit; no
     * streaming assumptions are permitted at this boundary.</p>
     *
     * @throws TransportException if the endpoint has no connected peer
     */
    void send(byte[] frame);

    /**
     * Register the listener that receives inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(FrameEndpointListener listener);
}
