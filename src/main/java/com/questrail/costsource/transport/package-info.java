/**
 * Transport port for the in-process harness.
 *
 * <p>The port moves opaque frames between one client and one server. It knows
 * nothing about RPC methods, status codes or message encoding; those live in
 * {@code com.questrail.costsource.rpc}.</p>
 *
 * <p>Framework types (Netty channels, buffers, event loops) never cross this
 * package boundary. Adapters copy payloads into {@code byte[]} before handing
 * them to a {@link com.questrail.costsource.transport.FrameEndpointListener}.</p>
 */
package com.questrail.costsource.transport;
