package com.questrail.costsource.api;

public record EstimateCostResponse(String currency, double costMonthly) {
}
