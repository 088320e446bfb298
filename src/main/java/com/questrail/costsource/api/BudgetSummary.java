package com.questrail.costsource.api;

public record BudgetSummary(
        int totalBudgets,
        int budgetsOk,
        int budgetsWarning,
        int budgetsCritical,
        int budgetsExceeded
) {
}
