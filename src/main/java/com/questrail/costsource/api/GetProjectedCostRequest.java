package com.questrail.costsource.api;

public record GetProjectedCostRequest(ResourceDescriptor resource) {
}
