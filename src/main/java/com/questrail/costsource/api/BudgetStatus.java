package com.questrail.costsource.api;

public record BudgetStatus(
        double currentSpend,
        double forecastedSpend,
        double percentageUsed,
        double percentageForecasted,
        String currency,
        BudgetHealthStatus health
) {
}
