package com.questrail.costsource.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record GetBudgetsResponse(List<Budget> budgets, BudgetSummary summary) {
    public GetBudgetsResponse {
        budgets = (budgets == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(budgets));
    }
}
