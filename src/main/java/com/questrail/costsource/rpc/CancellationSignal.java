package com.questrail.costsource.rpc;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancellationSignal
 * -----------------------------------------------------------------------------
 * Caller-side cancellation for harness calls.
 *
 * <p>A caller passes the signal in {@link CallOptions}; cancelling it makes the
 * outstanding call return {@link com.questrail.costsource.api.StatusCode#CANCELLED}
 * immediately and propagates the cancellation to the server-side
 * {@link com.questrail.costsource.api.CallContext}. A signal may be shared by
 * many calls and is one-shot.</p>
 */
public final class CancellationSignal
{
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel()
    {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable r : listeners) {
                r.run();
            }
        }
    }

    public boolean isCancelled()
    {
        return cancelled.get();
    }

    /**
     * Registers {@code action} to run on cancellation, or runs it immediately
     * if already cancelled. Closing the returned handle deregisters it.
     */
    public Registration onCancel(Runnable action)
    {
        Objects.requireNonNull(action, "action");
        listeners.add(action);
        if (cancelled.get() && listeners.remove(action)) {
            action.run();
        }
        return () -> listeners.remove(action);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable
    {
        @Override
        void close();
    }
}
