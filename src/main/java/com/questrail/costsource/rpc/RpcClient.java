package com.questrail.costsource.rpc;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.internal.time.MonotonicClock;
import com.questrail.costsource.transport.FrameEndpoint;
import com.questrail.costsource.transport.FrameEndpointListener;
import com.questrail.costsource.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RpcClient
 * =============================================================================
 * Client half of the harness: encodes requests, correlates responses by call
 * id and maps the outcome to a return value or an {@link RpcException}.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>OK response: the decoded response message is returned</li>
 *   <li>non-OK response: {@link RpcException} with the server's status</li>
 *   <li>no response within the timeout: {@link StatusCode#DEADLINE_EXCEEDED},
 *       and a {@code CANCEL} frame is sent to the server</li>
 *   <li>caller cancellation: {@link StatusCode#CANCELLED}, and a {@code CANCEL}
 *       frame is sent to the server</li>
 *   <li>transport unavailable: {@link StatusCode#UNAVAILABLE}</li>
 * </ul>
 *
 * <p>Every call, successful or not, reports a {@link CallStats} to the
 * options' stats sink.</p>
 */
public final class RpcClient implements FrameEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

    private final FrameEndpoint endpoint;
    private final RpcFrameCodec codec;
    private final Duration defaultTimeout;
    private final MonotonicClock clock;

    private final AtomicLong nextCallId = new AtomicLong(1);
    private final Map<Long, CompletableFuture<RpcFrame>> pending = new ConcurrentHashMap<>();

    private volatile boolean open;

    public RpcClient(FrameEndpoint endpoint, RpcFrameCodec codec, Duration defaultTimeout, MonotonicClock clock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isOpen()
    {
        return open;
    }

    public Object call(CostSourceMethod method, Object request, CallOptions options)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(options, "options");

        Duration timeout = (options.timeout() != null) ? options.timeout() : defaultTimeout;
        long start = clock.nowNanos();

        StatusCode status = StatusCode.UNKNOWN;
        RpcFrame response = null;
        int requestBytes = 0;
        long callId = nextCallId.getAndIncrement();
        CancellationSignal.Registration registration = null;

        try {
            byte[] payload;
            try {
                payload = codec.encodeMessage(request);
            }
            catch (RpcException e) {
                status = e.code();
                throw e;
            }
            requestBytes = payload.length;

            if (!open) {
                status = StatusCode.UNAVAILABLE;
                throw new RpcException(StatusCode.UNAVAILABLE, "channel is not connected");
            }

            CompletableFuture<RpcFrame> future = new CompletableFuture<>();
            pending.put(callId, future);
            if (options.cancellation() != null) {
                registration = options.cancellation().onCancel(() -> future.completeExceptionally(
                        new RpcException(StatusCode.CANCELLED, "call cancelled by caller")));
            }

            try {
                long timeoutMillis = Math.max(1, timeout.toMillis());
                endpoint.send(codec.encodeFrame(RpcFrame.request(callId, method.wireName(), timeoutMillis, payload)));
                response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
            catch (TransportException e) {
                status = StatusCode.UNAVAILABLE;
                throw new RpcException(StatusCode.UNAVAILABLE, "transport failure: " + e.getMessage(), e);
            }
            catch (TimeoutException e) {
                status = StatusCode.DEADLINE_EXCEEDED;
                sendCancel(callId);
                throw new RpcException(StatusCode.DEADLINE_EXCEEDED,
                        "deadline exceeded after " + timeout.toMillis() + "ms");
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = StatusCode.CANCELLED;
                sendCancel(callId);
                throw new RpcException(StatusCode.CANCELLED, "caller interrupted", e);
            }
            catch (ExecutionException e) {
                RpcException failure = (e.getCause() instanceof RpcException rpc)
                        ? rpc
                        : new RpcException(StatusCode.UNKNOWN, String.valueOf(e.getCause()), e.getCause());
                status = failure.code();
                if (status == StatusCode.CANCELLED) {
                    sendCancel(callId);
                }
                throw failure;
            }

            status = response.status();
            if (status != StatusCode.OK) {
                throw new RpcException(status, response.message(), response.implementationFault(), null);
            }

            try {
                return codec.decodeMessage(response.payload(), method.responseType());
            }
            catch (RpcException e) {
                status = e.code();
                throw e;
            }
        }
        finally {
            pending.remove(callId);
            if (registration != null) {
                registration.close();
            }
            options.statsSink().accept(new CallStats(
                    method,
                    status,
                    clock.elapsedSince(start),
                    (response != null) ? response.serverNanos() : 0L,
                    (response != null) ? response.serverAllocatedBytes() : AllocationMeter.UNAVAILABLE,
                    requestBytes,
                    (response != null) ? response.payload().length : 0));
        }
    }

    /**
     * Fails every outstanding call with {@link StatusCode#UNAVAILABLE} and
     * refuses new ones.
     */
    public void close()
    {
        open = false;
        failPending("client closed");
    }

    @Override
    public void onTransportUp()
    {
        open = true;
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        open = false;
        failPending((cause != null) ? "transport down: " + cause.getMessage() : "transport closed");
    }

    @Override
    public void onFrame(byte[] bytes)
    {
        RpcFrame frame;
        try {
            frame = codec.decodeFrame(bytes);
        }
        catch (RpcFrameException e) {
            log.warn("Discarding undecodable frame ({} bytes)", bytes.length, e);
            return;
        }

        if (frame.type() != RpcFrame.Type.RESPONSE) {
            log.debug("Ignoring {} frame on client side", frame.type());
            return;
        }

        CompletableFuture<RpcFrame> future = pending.get(frame.callId());
        if (future == null) {
            log.debug("Late response for call {} discarded", frame.callId());
            return;
        }
        future.complete(frame);
    }

    private void sendCancel(long callId)
    {
        try {
            endpoint.send(codec.encodeFrame(RpcFrame.cancel(callId)));
        }
        catch (TransportException e) {
            log.debug("Could not propagate cancellation of call {}: {}", callId, e.getMessage());
        }
    }

    private void failPending(String reason)
    {
        for (CompletableFuture<RpcFrame> future : pending.values()) {
            future.completeExceptionally(new RpcException(StatusCode.UNAVAILABLE, reason));
        }
    }
}
