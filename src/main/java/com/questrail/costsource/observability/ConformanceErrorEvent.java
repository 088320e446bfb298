package com.questrail.costsource.observability;

import java.time.Instant;

/**
 * Record representing a harness infrastructure failure.
 */
public record ConformanceErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
