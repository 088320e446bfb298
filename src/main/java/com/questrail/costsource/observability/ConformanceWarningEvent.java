package com.questrail.costsource.observability;

import com.questrail.costsource.conformance.TestCategory;

import java.time.Instant;

/**
 * Record representing a non-fatal annotation raised during a run, such as
 * race detection being inactive or a latency close to its ceiling.
 */
public record ConformanceWarningEvent(
    Instant timestamp,
    TestCategory category,
    String testName,
    String message
) {
}
