package com.questrail.costsource.conformance.perf;

import java.util.Objects;

/**
 * Minimum, mean and maximum of a set of latency samples, in nanoseconds.
 */
public record LatencyStats(long count, long minNanos, double meanNanos, long maxNanos)
{
    public LatencyStats {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
    }

    public static LatencyStats of(long[] samples)
    {
        Objects.requireNonNull(samples, "samples");
        if (samples.length == 0) {
            throw new IllegalArgumentException("no samples");
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        double sum = 0;
        for (long s : samples) {
            min = Math.min(min, s);
            max = Math.max(max, s);
            sum += s;
        }
        return new LatencyStats(samples.length, min, sum / samples.length, max);
    }

    public double minMillis()
    {
        return minNanos / 1_000_000.0;
    }

    public double meanMillis()
    {
        return meanNanos / 1_000_000.0;
    }

    public double maxMillis()
    {
        return maxNanos / 1_000_000.0;
    }
}
