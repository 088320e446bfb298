package com.questrail.costsource.api;

public record GetPricingSpecRequest(ResourceDescriptor resource) {
}
