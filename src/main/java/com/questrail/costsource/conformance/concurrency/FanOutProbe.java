package com.questrail.costsource.conformance.concurrency;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.harness.CostSourceClient;
import com.questrail.costsource.rpc.CallOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * FanOutProbe
 * =============================================================================
 * Dispatches {@code fanOut} identical calls at once and collects every reply.
 *
 * <h2>Dispatch</h2>
 * Each call runs on its own thread of a pool created for the probe. All
 * threads park on a start gate that opens only once every one of them is
 * ready, so the calls reach the harness together and in no particular order.
 *
 * <h2>Collection</h2>
 * The probe waits for all replies. Each call is bounded by the per-call
 * timeout, and the wait for a reply adds a short grace period on top of it.
 * A call that still has not returned is recorded as
 * {@link StatusCode#DEADLINE_EXCEEDED}. If the probing thread is interrupted,
 * every reply not yet collected is recorded as {@link StatusCode#CANCELLED}
 * and the interrupt flag is kept.
 *
 * <h2>Verification</h2>
 * The caller supplies a verifier over the successful responses; it returns a
 * failure description or empty. The probe moves through {@link ProbeState}
 * and is single-use.
 */
public final class FanOutProbe
{
    private static final Logger log = LoggerFactory.getLogger(FanOutProbe.class);

    static final Duration COLLECT_GRACE = Duration.ofSeconds(5);

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final CostSourceClient client;
    private final CostSourceMethod method;
    private final Object request;
    private final int fanOut;
    private final Duration callTimeout;

    private volatile ProbeState state = ProbeState.IDLE;

    public FanOutProbe(CostSourceClient client, CostSourceMethod method, Object request, int fanOut,
                       Duration callTimeout)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.method = Objects.requireNonNull(method, "method");
        this.request = request;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        if (fanOut < 1) {
            throw new IllegalArgumentException("fanOut must be at least 1");
        }
        this.fanOut = fanOut;
    }

    public ProbeState state()
    {
        return state;
    }

    /**
     * Runs the probe once.
     *
     * @param verifier checks the successful responses; returns a failure
     *                 description, or empty when they are acceptable
     */
    public ProbeResult run(Function<List<Object>, Optional<String>> verifier)
    {
        Objects.requireNonNull(verifier, "verifier");
        moveTo(ProbeState.DISPATCHING);

        ExecutorService pool = Executors.newFixedThreadPool(fanOut, threadFactory());
        List<Reply> replies = new ArrayList<>(fanOut);
        try {
            dispatchAndCollect(pool, replies);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fan-out probe of {} interrupted after {} of {} replies",
                    method.wireName(), replies.size(), fanOut);
            while (replies.size() < fanOut) {
                replies.add(Reply.error(new RpcException(StatusCode.CANCELLED, "fan-out interrupted", e)));
            }
        }
        finally {
            pool.shutdownNow();
        }
        return verify(replies, verifier);
    }

    private void dispatchAndCollect(ExecutorService pool, List<Reply> replies) throws InterruptedException
    {
        CountDownLatch ready = new CountDownLatch(fanOut);
        CountDownLatch gate = new CountDownLatch(1);
        CallOptions options = CallOptions.withTimeout(callTimeout);

        List<Future<Reply>> futures = new ArrayList<>(fanOut);
        for (int i = 0; i < fanOut; i++) {
            futures.add(pool.submit(() -> {
                ready.countDown();
                gate.await();
                try {
                    return Reply.ok(client.call(method, request, options));
                }
                catch (RpcException e) {
                    return Reply.error(e);
                }
            }));
        }

        ready.await();
        gate.countDown();
        moveTo(ProbeState.COLLECTING);

        long waitNanos = callTimeout.plus(COLLECT_GRACE).toNanos();
        for (Future<Reply> f : futures) {
            replies.add(collect(f, waitNanos));
        }
    }

    private Reply collect(Future<Reply> future, long waitNanos) throws InterruptedException
    {
        try {
            return future.get(waitNanos, TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            return Reply.error(new RpcException(StatusCode.DEADLINE_EXCEEDED,
                    "no reply within " + callTimeout.plus(COLLECT_GRACE).toMillis() + "ms"));
        }
        catch (ExecutionException e) {
            log.warn("Fan-out call to {} ended abnormally", method.wireName(), e.getCause());
            return Reply.error(new RpcException(StatusCode.UNKNOWN, String.valueOf(e.getCause()), e.getCause()));
        }
    }

    private ProbeResult verify(List<Reply> replies, Function<List<Object>, Optional<String>> verifier)
    {
        List<Object> responses = new ArrayList<>();
        for (Reply r : replies) {
            if (r.error() != null) {
                moveTo(ProbeState.FAILED);
                return new ProbeResult(ProbeState.FAILED, replies, Optional.empty());
            }
            responses.add(r.response());
        }

        Optional<String> failure = verifier.apply(responses);
        ProbeState end = failure.isPresent() ? ProbeState.FAILED : ProbeState.VERIFIED;
        moveTo(end);
        return new ProbeResult(end, replies, failure);
    }

    private void moveTo(ProbeState next)
    {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("probe cannot move from " + state + " to " + next);
        }
        state = next;
    }

    private ThreadFactory threadFactory()
    {
        String prefix = "conformance-fanout-" + POOL_SEQUENCE.incrementAndGet() + "-";
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Result of one call: a response or the status it failed with.
     */
    public record Reply(Object response, RpcException error)
    {
        static Reply ok(Object response)
        {
            return new Reply(response, null);
        }

        static Reply error(RpcException error)
        {
            return new Reply(null, error);
        }
    }

    /**
     * Terminal state, every reply, and the verifier's finding if any.
     * {@code failure} is empty for a probe that failed because a call did.
     */
    public record ProbeResult(ProbeState state, List<Reply> replies, Optional<String> failure)
    {
        public ProbeResult {
            replies = List.copyOf(replies);
        }

        public List<RpcException> errors()
        {
            return replies.stream().map(Reply::error).filter(Objects::nonNull).toList();
        }
    }
}
