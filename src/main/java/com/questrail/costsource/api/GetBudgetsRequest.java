package com.questrail.costsource.api;

public record GetBudgetsRequest(String provider, boolean includeStatus) {
}
