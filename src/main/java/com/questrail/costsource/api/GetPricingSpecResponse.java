package com.questrail.costsource.api;

public record GetPricingSpecResponse(PricingSpec spec) {
}
