package com.questrail.costsource.api;

import java.util.Map;

/**
 * Answer to {@code Supports}.
 *
 * <p>{@code capabilities} is the plugin's capability advertisement: one flag per
 * optional method, keyed by {@link CostSourceMethod#capabilityKey()}.</p>
 */
public record SupportsResponse(
        boolean supported,
        String reason,
        Map<String, Boolean> capabilities
) {
    public SupportsResponse {
        capabilities = (capabilities == null) ? Map.of() : Map.copyOf(capabilities);
    }

    public static SupportsResponse supported(Map<String, Boolean> capabilities)
    {
        return new SupportsResponse(true, "", capabilities);
    }

    public static SupportsResponse unsupported(String reason, Map<String, Boolean> capabilities)
    {
        return new SupportsResponse(false, reason, capabilities);
    }

    public boolean advertises(CostSourceMethod method)
    {
        return method.capabilityKey() != null
                && Boolean.TRUE.equals(capabilities.get(method.capabilityKey()));
    }
}
