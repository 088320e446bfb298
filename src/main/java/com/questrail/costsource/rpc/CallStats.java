package com.questrail.costsource.rpc;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.StatusCode;

/**
 * Measurements for one completed harness call.
 *
 * <p>{@code serverAllocatedBytes} is {@link AllocationMeter#UNAVAILABLE} when
 * the server could not measure it or the call never reached the
 * implementation.</p>
 */
public record CallStats(
        CostSourceMethod method,
        StatusCode status,
        long clientNanos,
        long serverNanos,
        long serverAllocatedBytes,
        int requestBytes,
        int responseBytes
) {
}
