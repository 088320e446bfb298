package com.questrail.costsource.api;

/**
 * A spending budget reported by a plugin. {@code status} is present only when
 * the request asked for it.
 */
public record Budget(
        String id,
        String name,
        String source,
        BudgetAmount amount,
        BudgetPeriod period,
        BudgetStatus status
) {
}
