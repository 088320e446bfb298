package com.questrail.costsource.rpc;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Per-call options: timeout, caller cancellation and a stats callback.
 *
 * <p>A {@code null} timeout means the client default; a {@code null}
 * cancellation means the call can only end by completing or timing out.</p>
 */
public record CallOptions(
        Duration timeout,
        CancellationSignal cancellation,
        Consumer<CallStats> statsSink
) {
    private static final CallOptions DEFAULTS = new CallOptions(null, null, null);

    public CallOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        statsSink = (statsSink == null) ? s -> {} : statsSink;
    }

    public static CallOptions defaults()
    {
        return DEFAULTS;
    }

    public static CallOptions withTimeout(Duration timeout)
    {
        return new CallOptions(Objects.requireNonNull(timeout, "timeout"), null, null);
    }

    public CallOptions withStatsSink(Consumer<CallStats> sink)
    {
        return new CallOptions(timeout, cancellation, sink);
    }

    public CallOptions withCancellation(CancellationSignal signal)
    {
        return new CallOptions(timeout, signal, statsSink);
    }
}
