package com.questrail.costsource.api;

/**
 * Pricing specification for a single resource.
 *
 * <p>{@code billingMode} is a string drawn from a closed domain (e.g.
 * {@code per_hour}, {@code on_demand}); the domain is enforced by conformance
 * checks rather than by this type so that malformed plugin output can be
 * represented and reported.</p>
 */
public record PricingSpec(
        String provider,
        String resourceType,
        String sku,
        String region,
        String billingMode,
        double ratePerUnit,
        String currency,
        String description
) {
}
