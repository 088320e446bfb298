package com.questrail.costsource.harness;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.EstimateCostRequest;
import com.questrail.costsource.api.EstimateCostResponse;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetActualCostResponse;
import com.questrail.costsource.api.GetBudgetsRequest;
import com.questrail.costsource.api.GetBudgetsResponse;
import com.questrail.costsource.api.GetPricingSpecRequest;
import com.questrail.costsource.api.GetPricingSpecResponse;
import com.questrail.costsource.api.GetProjectedCostRequest;
import com.questrail.costsource.api.GetProjectedCostResponse;
import com.questrail.costsource.api.GetRecommendationsRequest;
import com.questrail.costsource.api.GetRecommendationsResponse;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.SupportsRequest;
import com.questrail.costsource.api.SupportsResponse;
import com.questrail.costsource.rpc.CallOptions;
import com.questrail.costsource.rpc.RpcClient;

import java.util.Objects;

/**
 * CostSourceClient
 * =============================================================================
 * Typed client handle returned by {@link InProcessHarness#start}.
 *
 * <p>Every call crosses the in-memory channel: the request is encoded, sent,
 * decoded and dispatched on the server side, and the response or status comes
 * back the same way. Failures surface as
 * {@link com.questrail.costsource.api.RpcException}.</p>
 *
 * <p>Safe for concurrent use.</p>
 */
public final class CostSourceClient
{
    private final RpcClient rpc;

    CostSourceClient(RpcClient rpc)
    {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    /**
     * Untyped entry point used by checks that iterate over methods.
     */
    public Object call(CostSourceMethod method, Object request, CallOptions options)
    {
        return rpc.call(method, request, options);
    }

    public Object call(CostSourceMethod method, Object request)
    {
        return call(method, request, CallOptions.defaults());
    }

    public NameResponse name(NameRequest request)
    {
        return name(request, CallOptions.defaults());
    }

    public NameResponse name(NameRequest request, CallOptions options)
    {
        return (NameResponse) call(CostSourceMethod.NAME, request, options);
    }

    public SupportsResponse supports(SupportsRequest request)
    {
        return supports(request, CallOptions.defaults());
    }

    public SupportsResponse supports(SupportsRequest request, CallOptions options)
    {
        return (SupportsResponse) call(CostSourceMethod.SUPPORTS, request, options);
    }

    public GetActualCostResponse getActualCost(GetActualCostRequest request)
    {
        return getActualCost(request, CallOptions.defaults());
    }

    public GetActualCostResponse getActualCost(GetActualCostRequest request, CallOptions options)
    {
        return (GetActualCostResponse) call(CostSourceMethod.GET_ACTUAL_COST, request, options);
    }

    public GetProjectedCostResponse getProjectedCost(GetProjectedCostRequest request)
    {
        return getProjectedCost(request, CallOptions.defaults());
    }

    public GetProjectedCostResponse getProjectedCost(GetProjectedCostRequest request, CallOptions options)
    {
        return (GetProjectedCostResponse) call(CostSourceMethod.GET_PROJECTED_COST, request, options);
    }

    public GetPricingSpecResponse getPricingSpec(GetPricingSpecRequest request)
    {
        return getPricingSpec(request, CallOptions.defaults());
    }

    public GetPricingSpecResponse getPricingSpec(GetPricingSpecRequest request, CallOptions options)
    {
        return (GetPricingSpecResponse) call(CostSourceMethod.GET_PRICING_SPEC, request, options);
    }

    public EstimateCostResponse estimateCost(EstimateCostRequest request)
    {
        return estimateCost(request, CallOptions.defaults());
    }

    public EstimateCostResponse estimateCost(EstimateCostRequest request, CallOptions options)
    {
        return (EstimateCostResponse) call(CostSourceMethod.ESTIMATE_COST, request, options);
    }

    public GetRecommendationsResponse getRecommendations(GetRecommendationsRequest request)
    {
        return getRecommendations(request, CallOptions.defaults());
    }

    public GetRecommendationsResponse getRecommendations(GetRecommendationsRequest request, CallOptions options)
    {
        return (GetRecommendationsResponse) call(CostSourceMethod.GET_RECOMMENDATIONS, request, options);
    }

    public GetBudgetsResponse getBudgets(GetBudgetsRequest request)
    {
        return getBudgets(request, CallOptions.defaults());
    }

    public GetBudgetsResponse getBudgets(GetBudgetsRequest request, CallOptions options)
    {
        return (GetBudgetsResponse) call(CostSourceMethod.GET_BUDGETS, request, options);
    }
}
