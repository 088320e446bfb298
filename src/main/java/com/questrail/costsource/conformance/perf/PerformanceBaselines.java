package com.questrail.costsource.conformance.perf;

import com.questrail.costsource.api.CostSourceMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * PerformanceBaselines
 * =============================================================================
 * The default baseline table, one entry per contract method.
 *
 * <h2>Default ceilings</h2>
 * <pre>
 *   Method              Standard   Advanced   Allocation
 *   Name                  100 ms      50 ms      64 KiB
 *   Supports               50 ms      25 ms      64 KiB
 *   GetActualCost        2000 ms    1000 ms       1 MiB
 *   GetProjectedCost      200 ms     100 ms     128 KiB
 *   GetPricingSpec        200 ms     100 ms     128 KiB
 *   EstimateCost          200 ms     100 ms     128 KiB
 *   GetRecommendations   2000 ms    1000 ms       1 MiB
 *   GetBudgets           5000 ms    2000 ms       1 MiB
 * </pre>
 *
 * <p>A fresh table is built for every call; nothing here is shared mutable
 * state.</p>
 */
public final class PerformanceBaselines
{
    private static final long KIB = 1024;
    private static final long MIB = 1024 * KIB;

    private PerformanceBaselines()
    {
    }

    public static Map<CostSourceMethod, PerformanceBaseline> defaults()
    {
        Map<CostSourceMethod, PerformanceBaseline> table = new EnumMap<>(CostSourceMethod.class);
        put(table, PerformanceBaseline.of(CostSourceMethod.NAME, 100, 50, 64 * KIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.SUPPORTS, 50, 25, 64 * KIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.GET_ACTUAL_COST, 2000, 1000, MIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.GET_PROJECTED_COST, 200, 100, 128 * KIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.GET_PRICING_SPEC, 200, 100, 128 * KIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.ESTIMATE_COST, 200, 100, 128 * KIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.GET_RECOMMENDATIONS, 2000, 1000, MIB));
        put(table, PerformanceBaseline.of(CostSourceMethod.GET_BUDGETS, 5000, 2000, MIB));
        return table;
    }

    /**
     * Default table with {@code overrides} applied on top.
     */
    public static Map<CostSourceMethod, PerformanceBaseline> resolve(Map<CostSourceMethod, PerformanceBaseline> overrides)
    {
        Objects.requireNonNull(overrides, "overrides");
        Map<CostSourceMethod, PerformanceBaseline> table = defaults();
        table.putAll(overrides);
        return Collections.unmodifiableMap(table);
    }

    private static void put(Map<CostSourceMethod, PerformanceBaseline> table, PerformanceBaseline baseline)
    {
        table.put(baseline.method(), baseline);
    }
}
