package com.questrail.costsource.rpc;

import com.questrail.costsource.api.CallContext;
import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.CostSourceService;
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
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * RpcServer
 * =============================================================================
 * Server half of the harness: decodes request frames, dispatches them to a
 * {@link CostSourceService} on a worker pool and writes response frames back.
 *
 * <h2>Fault boundary</h2>
 * Every invocation runs inside a boundary that converts abnormal termination of
 * the implementation (any {@link Throwable} other than {@link RpcException})
 * into an {@link StatusCode#INTERNAL} response flagged as an implementation
 * fault, with the fault message as detail. Nothing thrown by the implementation
 * unwinds past this class.
 *
 * <h2>Deadlines and cancellation</h2>
 * Each call gets its own {@link CallContext} carrying the client's propagated
 * timeout. A {@code CANCEL} frame, or loss of the transport, cancels the
 * context and interrupts the worker running the call.
 *
 * <h2>Threading</h2>
 * {@link #onFrame(byte[])} runs on the transport's event loop and never blocks;
 * invocations run on the supplied executor.
 */
public final class RpcServer implements FrameEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    private final CostSourceService implementation;
    private final FrameEndpoint endpoint;
    private final RpcFrameCodec codec;
    private final ExecutorService workers;
    private final MonotonicClock clock;

    private final Map<Long, InFlight> inFlight = new ConcurrentHashMap<>();

    public RpcServer(CostSourceService implementation,
                     FrameEndpoint endpoint,
                     RpcFrameCodec codec,
                     ExecutorService workers,
                     MonotonicClock clock)
    {
        this.implementation = Objects.requireNonNull(implementation, "implementation");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int inFlightCount()
    {
        return inFlight.size();
    }

    @Override
    public void onTransportUp()
    {
        log.debug("RPC server transport up");
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        if (cause != null) {
            log.warn("RPC server transport down", cause);
        }
        for (InFlight call : inFlight.values()) {
            call.cancel();
        }
        inFlight.clear();
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

        switch (frame.type()) {
            case REQUEST -> accept(frame);
            case CANCEL -> {
                InFlight call = inFlight.remove(frame.callId());
                if (call != null) {
                    call.cancel();
                }
            }
            case RESPONSE -> log.debug("Ignoring response frame for call {} on server side", frame.callId());
        }
    }

    private void accept(RpcFrame frame)
    {
        CallContext ctx = (frame.timeoutMillis() > 0)
                ? CallContext.withTimeout(Duration.ofMillis(frame.timeoutMillis()), clock)
                : CallContext.background();

        InFlight call = new InFlight(ctx);
        inFlight.put(frame.callId(), call);
        try {
            call.task = workers.submit(() -> handle(frame, ctx));
        }
        catch (RejectedExecutionException e) {
            inFlight.remove(frame.callId());
            reply(RpcFrame.error(frame.callId(), StatusCode.UNAVAILABLE, "server is shutting down", false, 0,
                    AllocationMeter.UNAVAILABLE));
        }
    }

    private void handle(RpcFrame frame, CallContext ctx)
    {
        try {
            reply(dispatch(frame, ctx));
        }
        finally {
            inFlight.remove(frame.callId());
        }
    }

    RpcFrame dispatch(RpcFrame frame, CallContext ctx)
    {
        long callId = frame.callId();

        Optional<CostSourceMethod> resolved = CostSourceMethod.fromWireName(frame.method());
        if (resolved.isEmpty()) {
            return RpcFrame.error(callId, StatusCode.UNIMPLEMENTED, "unknown method " + frame.method(), false, 0,
                    AllocationMeter.UNAVAILABLE);
        }
        CostSourceMethod method = resolved.get();

        Object request;
        try {
            request = codec.decodeMessage(frame.payload(), method.requestType());
        }
        catch (RpcException e) {
            return RpcFrame.error(callId, e.code(), e.getMessage(), false, 0, AllocationMeter.UNAVAILABLE);
        }

        long allocStart = AllocationMeter.currentThreadAllocatedBytes();
        long start = clock.nowNanos();

        Object response;
        try {
            ctx.checkActive();
            response = method.invoke(implementation, ctx, request);
        }
        catch (RpcException e) {
            return RpcFrame.error(callId, e.code(), e.getMessage(), e.isImplementationFault(),
                    clock.elapsedSince(start), allocatedSince(allocStart));
        }
        catch (Throwable t) {
            log.warn("Implementation fault in {} recovered at the transport boundary", method.wireName(), t);
            return RpcFrame.error(callId, StatusCode.INTERNAL, "implementation panicked: " + describe(t), true,
                    clock.elapsedSince(start), allocatedSince(allocStart));
        }

        long serverNanos = clock.elapsedSince(start);
        long allocated = allocatedSince(allocStart);

        if (response == null) {
            return RpcFrame.error(callId, StatusCode.INTERNAL, method.wireName() + " returned no response", false,
                    serverNanos, allocated);
        }

        try {
            return RpcFrame.ok(callId, serverNanos, allocated, codec.encodeMessage(response));
        }
        catch (RpcException e) {
            return RpcFrame.error(callId, e.code(), "response rejected: " + e.getMessage(), false,
                    serverNanos, allocated);
        }
    }

    private void reply(RpcFrame response)
    {
        try {
            endpoint.send(codec.encodeFrame(response));
        }
        catch (TransportException e) {
            log.debug("Dropping response for call {}: {}", response.callId(), e.getMessage());
        }
    }

    private static long allocatedSince(long allocStart)
    {
        if (allocStart == AllocationMeter.UNAVAILABLE) {
            return AllocationMeter.UNAVAILABLE;
        }
        return Math.max(0, AllocationMeter.currentThreadAllocatedBytes() - allocStart);
    }

    private static String describe(Throwable t)
    {
        String message = t.getMessage();
        return (message == null || message.isBlank()) ? t.getClass().getName() : message;
    }

    private static final class InFlight
    {
        private final CallContext ctx;
        private volatile Future<?> task;

        InFlight(CallContext ctx)
        {
            this.ctx = ctx;
        }

        void cancel()
        {
            ctx.cancel();
            Future<?> t = task;
            if (t != null) {
                t.cancel(true);
            }
        }
    }
}
