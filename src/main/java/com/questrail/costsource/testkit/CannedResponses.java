package com.questrail.costsource.testkit;

import com.questrail.costsource.api.ActualCostResult;
import com.questrail.costsource.api.Budget;
import com.questrail.costsource.api.BudgetAmount;
import com.questrail.costsource.api.BudgetHealthStatus;
import com.questrail.costsource.api.BudgetPeriod;
import com.questrail.costsource.api.BudgetStatus;
import com.questrail.costsource.api.BudgetSummary;
import com.questrail.costsource.api.EstimateCostResponse;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetActualCostResponse;
import com.questrail.costsource.api.GetBudgetsRequest;
import com.questrail.costsource.api.GetBudgetsResponse;
import com.questrail.costsource.api.GetPricingSpecRequest;
import com.questrail.costsource.api.GetPricingSpecResponse;
import com.questrail.costsource.api.GetProjectedCostResponse;
import com.questrail.costsource.api.GetRecommendationsResponse;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.PricingSpec;
import com.questrail.costsource.api.Recommendation;
import com.questrail.costsource.api.ResourceDescriptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CannedResponses
 * =============================================================================
 * Well-formed default responses for every contract method, modelled on an
 * on-demand {@code t3.micro} instance priced in USD.
 *
 * <p>Every value returned here passes the structural checks of the
 * specification validation category. Responses are built on demand; nothing
 * is cached or shared between doubles.</p>
 */
public final class CannedResponses
{
    public static final String PLUGIN_NAME = "mock-test-plugin";
    public static final String CURRENCY = "USD";
    public static final Set<String> PROVIDERS = Set.of("aws", "azure", "gcp", "kubernetes");

    public static final double HOURLY_RATE = 0.0104;
    public static final double HOURS_PER_MONTH = 730.0;

    /** Resource the conformance checks ask about. */
    public static final ResourceDescriptor TEST_RESOURCE = new ResourceDescriptor(
            "aws", "ec2", "t3.micro", "us-east-1",
            Map.of("environment", "test", "app", "integration-test"));

    private static final int MAX_DAILY_RESULTS = 31;

    private CannedResponses()
    {
    }

    public static NameResponse name()
    {
        return new NameResponse(PLUGIN_NAME);
    }

    public static GetProjectedCostResponse projectedCost()
    {
        return new GetProjectedCostResponse(HOURLY_RATE, CURRENCY, HOURLY_RATE * HOURS_PER_MONTH,
                "on-demand hourly rate");
    }

    public static GetPricingSpecResponse pricingSpec(GetPricingSpecRequest request)
    {
        ResourceDescriptor r = (request != null && request.resource() != null) ? request.resource() : TEST_RESOURCE;
        return new GetPricingSpecResponse(new PricingSpec(
                r.provider(), r.resourceType(), r.sku(), r.region(),
                "per_hour", HOURLY_RATE, CURRENCY,
                "On-demand compute priced per instance hour"));
    }

    /**
     * One result per whole day in the requested range (at least one, at most
     * {@value #MAX_DAILY_RESULTS}), each covering 24 instance hours.
     */
    public static GetActualCostResponse actualCost(GetActualCostRequest request)
    {
        Instant start = request.start();
        long days = Duration.between(start, request.end()).toDays();
        long count = Math.max(1, Math.min(MAX_DAILY_RESULTS, days));

        List<ActualCostResult> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            results.add(new ActualCostResult(
                    start.plus(Duration.ofDays(i)),
                    HOURLY_RATE * 24,
                    24,
                    "hours",
                    PLUGIN_NAME));
        }
        return new GetActualCostResponse(CURRENCY, results);
    }

    public static EstimateCostResponse estimateCost()
    {
        return new EstimateCostResponse(CURRENCY, HOURLY_RATE * HOURS_PER_MONTH);
    }

    public static GetRecommendationsResponse recommendations()
    {
        return new GetRecommendationsResponse(List.of(
                new Recommendation("rec-rightsize-001", "RIGHTSIZE", "i-0abc123",
                        "Downsize to t3.nano; average CPU below 5%", 3.80, CURRENCY, 0.85),
                new Recommendation("rec-commit-002", "PURCHASE_COMMITMENT", "i-0abc123",
                        "Cover steady usage with a one-year savings plan", 2.10, CURRENCY, 0.70)),
                "");
    }

    public static GetBudgetsResponse budgets(GetBudgetsRequest request)
    {
        boolean withStatus = request != null && request.includeStatus();
        List<Budget> budgets = List.of(
                new Budget("budget-dev-monthly", "Development (monthly)", PLUGIN_NAME,
                        new BudgetAmount(500.0, CURRENCY), BudgetPeriod.MONTHLY,
                        withStatus
                                ? new BudgetStatus(120.0, 410.0, 24.0, 82.0, CURRENCY, BudgetHealthStatus.OK)
                                : null),
                new Budget("budget-prod-quarterly", "Production (quarterly)", PLUGIN_NAME,
                        new BudgetAmount(9000.0, CURRENCY), BudgetPeriod.QUARTERLY,
                        withStatus
                                ? new BudgetStatus(7400.0, 9300.0, 82.2, 103.3, CURRENCY, BudgetHealthStatus.WARNING)
                                : null));
        return new GetBudgetsResponse(budgets, new BudgetSummary(2, 1, 1, 0, 0));
    }
}
