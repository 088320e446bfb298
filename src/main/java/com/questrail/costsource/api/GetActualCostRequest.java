package com.questrail.costsource.api;

import java.time.Instant;

public record GetActualCostRequest(String resourceId, Instant start, Instant end) {
}
