package com.questrail.costsource.api;

public record SupportsRequest(ResourceDescriptor resource) {
}
