package com.questrail.costsource.api;

public record GetProjectedCostResponse(
        double unitPrice,
        String currency,
        double costPerMonth,
        String billingDetail
) {
}
