package com.questrail.costsource.api;

public enum BudgetPeriod
{
    UNSPECIFIED,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    ANNUALLY
}
