package com.questrail.costsource.api;

public record Recommendation(
        String id,
        String actionType,
        String resourceId,
        String description,
        double estimatedSavings,
        String currency,
        double confidence
) {
}
