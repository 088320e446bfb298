package com.questrail.costsource.api;

import java.util.Map;

/**
 * Identifies a cloud resource a plugin is asked to price.
 */
public record ResourceDescriptor(
        String provider,
        String resourceType,
        String sku,
        String region,
        Map<String, String> tags
) {
    public ResourceDescriptor {
        tags = (tags == null) ? Map.of() : Map.copyOf(tags);
    }

    public static ResourceDescriptor of(String provider, String resourceType, String sku, String region)
    {
        return new ResourceDescriptor(provider, resourceType, sku, region, Map.of());
    }
}
