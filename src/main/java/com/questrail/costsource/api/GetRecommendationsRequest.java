package com.questrail.costsource.api;

/**
 * Request for cost optimisation recommendations.
 *
 * <p>{@code pageSize} of zero asks for the plugin default; negative values are
 * invalid.</p>
 */
public record GetRecommendationsRequest(String provider, int pageSize, String pageToken) {
}
