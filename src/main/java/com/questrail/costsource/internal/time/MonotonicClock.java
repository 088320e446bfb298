package com.questrail.costsource.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every latency, deadline and budget measurement in the harness.
 *
 * <h2>Binding invariant</h2>
 * Call latencies, per-call deadlines and the performance budget MUST be measured
 * against a monotonic source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for request payloads and report timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();

    /**
     * Nanoseconds elapsed since {@code startNanos}, a value previously returned
     * by {@link #nowNanos()} on this clock.
     */
    default long elapsedSince(long startNanos)
    {
        return nowNanos() - startNanos;
    }
}
