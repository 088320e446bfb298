package com.questrail.costsource.api;

import java.time.Instant;

public record ActualCostResult(
        Instant timestamp,
        double cost,
        double usageAmount,
        String usageUnit,
        String source
) {
}
