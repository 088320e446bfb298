package com.questrail.costsource.api;

public record BudgetAmount(double limit, String currency) {
}
