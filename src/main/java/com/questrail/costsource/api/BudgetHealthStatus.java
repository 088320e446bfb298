package com.questrail.costsource.api;

public enum BudgetHealthStatus
{
    UNSPECIFIED,
    OK,
    WARNING,
    CRITICAL,
    EXCEEDED
}
