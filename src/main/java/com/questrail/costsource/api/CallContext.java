package com.questrail.costsource.api;

import com.questrail.costsource.internal.time.MonotonicClock;
import com.questrail.costsource.internal.time.SystemMonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CallContext
 * =============================================================================
 * Per-call deadline and cancellation state seen by a {@link CostSourceService}.
 *
 * <p>The harness server creates one context per dispatched call from the
 * deadline propagated by the client, and cancels it when the client gives up.
 * Implementations that block (or simulate latency) should do so through
 * {@link #sleep(Duration)} or poll {@link #checkActive()} so that cancellation
 * and deadlines reach them the way they would over a real connection.</p>
 *
 * <h2>Thread Safety</h2>
 * Cancellation may be signalled from any thread; all queries are safe for
 * concurrent use.
 */
public final class CallContext
{
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final MonotonicClock clock;
    private final long deadlineNanos;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);

    private CallContext(MonotonicClock clock, long deadlineNanos)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * A context with no deadline, for direct (non-harness) invocation.
     */
    public static CallContext background()
    {
        return new CallContext(SystemMonotonicClock.INSTANCE, NO_DEADLINE);
    }

    public static CallContext withTimeout(Duration timeout)
    {
        return withTimeout(timeout, SystemMonotonicClock.INSTANCE);
    }

    public static CallContext withTimeout(Duration timeout, MonotonicClock clock)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        long now = clock.nowNanos();
        long nanos = saturatedNanos(timeout);
        long deadline = (NO_DEADLINE - now < nanos) ? NO_DEADLINE : now + nanos;
        return new CallContext(clock, deadline);
    }

    /**
     * Time left before the deadline, or empty when the call has none.
     */
    public Optional<Duration> remaining()
    {
        if (deadlineNanos == NO_DEADLINE) {
            return Optional.empty();
        }
        long left = deadlineNanos - clock.nowNanos();
        return Optional.of(Duration.ofNanos(Math.max(0, left)));
    }

    public boolean isCancelled()
    {
        return cancelSignal.getCount() == 0;
    }

    public boolean isExpired()
    {
        return deadlineNanos != NO_DEADLINE && clock.nowNanos() >= deadlineNanos;
    }

    /**
     * Signals that the caller is no longer interested in the result.
     */
    public void cancel()
    {
        cancelSignal.countDown();
    }

    /**
     * Throws {@link StatusCode#CANCELLED} or {@link StatusCode#DEADLINE_EXCEEDED}
     * if the call should stop now.
     */
    public void checkActive()
    {
        if (isCancelled()) {
            throw new RpcException(StatusCode.CANCELLED, "call cancelled by caller");
        }
        if (isExpired()) {
            throw new RpcException(StatusCode.DEADLINE_EXCEEDED, "deadline exceeded");
        }
    }

    /**
     * Blocks for {@code duration} unless the call is cancelled or its deadline
     * passes first, in which case the matching status is thrown.
     */
    public void sleep(Duration duration)
    {
        Objects.requireNonNull(duration, "duration");
        checkActive();

        long wanted = saturatedNanos(duration);
        long wait = remaining()
                .map(r -> Math.min(wanted, r.toNanos()))
                .orElse(wanted);

        boolean cancelled;
        try {
            cancelled = cancelSignal.await(wait, TimeUnit.NANOSECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(StatusCode.CANCELLED, "call interrupted", e);
        }

        if (cancelled) {
            throw new RpcException(StatusCode.CANCELLED, "call cancelled by caller");
        }
        if (wait < wanted) {
            throw new RpcException(StatusCode.DEADLINE_EXCEEDED, "deadline exceeded");
        }
    }

    private static long saturatedNanos(Duration d)
    {
        try {
            return d.toNanos();
        }
        catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
