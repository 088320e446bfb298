package com.questrail.costsource.api;

import java.util.Map;

public record EstimateCostRequest(ResourceDescriptor resource, Map<String, String> attributes) {
    public EstimateCostRequest {
        attributes = (attributes == null) ? Map.of() : Map.copyOf(attributes);
    }
}
