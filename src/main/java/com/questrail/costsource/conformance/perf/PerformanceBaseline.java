package com.questrail.costsource.conformance.perf;

import com.questrail.costsource.api.CostSourceMethod;

import java.time.Duration;
import java.util.Objects;

/**
 * PerformanceBaseline
 * -----------------------------------------------------------------------------
 * Expected ceilings for one contract method.
 *
 * <ul>
 *   <li><b>standardLatency</b>: mean latency ceiling gating Standard</li>
 *   <li><b>advancedLatency</b>: stricter mean latency ceiling gating Advanced</li>
 *   <li><b>allocationBytes</b>: mean server-side allocation ceiling per call</li>
 * </ul>
 */
public record PerformanceBaseline(
        CostSourceMethod method,
        Duration standardLatency,
        Duration advancedLatency,
        long allocationBytes
) {
    public PerformanceBaseline {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(standardLatency, "standardLatency");
        Objects.requireNonNull(advancedLatency, "advancedLatency");

        if (standardLatency.isNegative() || standardLatency.isZero()) {
            throw new IllegalArgumentException("standardLatency must be positive");
        }
        if (advancedLatency.isNegative() || advancedLatency.isZero()) {
            throw new IllegalArgumentException("advancedLatency must be positive");
        }
        if (advancedLatency.compareTo(standardLatency) > 0) {
            throw new IllegalArgumentException("advancedLatency must not exceed standardLatency");
        }
        if (allocationBytes <= 0) {
            throw new IllegalArgumentException("allocationBytes must be positive");
        }
    }

    public static PerformanceBaseline of(CostSourceMethod method, long standardMillis, long advancedMillis,
                                         long allocationBytes)
    {
        return new PerformanceBaseline(method, Duration.ofMillis(standardMillis), Duration.ofMillis(advancedMillis),
                allocationBytes);
    }

    /**
     * Same baseline with a different Standard ceiling; the Advanced ceiling is
     * clamped so it never exceeds the new Standard one.
     */
    public PerformanceBaseline withStandardLatency(Duration ceiling)
    {
        Duration advanced = (advancedLatency.compareTo(ceiling) > 0) ? ceiling : advancedLatency;
        return new PerformanceBaseline(method, ceiling, advanced, allocationBytes);
    }
}
