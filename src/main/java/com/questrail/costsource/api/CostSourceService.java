package com.questrail.costsource.api;

/**
 * CostSourceService
 * =============================================================================
 * The contract every cost source plugin implements.
 *
 * <p>Five methods are required. The three optional methods default to
 * {@link StatusCode#UNIMPLEMENTED}; a plugin that implements one of them should
 * also advertise it through {@link SupportsResponse#capabilities()}.</p>
 *
 * <h2>Status semantics</h2>
 * A method returns its response on success or throws {@link RpcException}
 * with a non-OK {@link StatusCode}. Any other exception escaping a method is
 * an implementation fault; the harness reports it as {@link StatusCode#INTERNAL}.
 *
 * <h2>Threading</h2>
 * Implementations are invoked concurrently from multiple threads and must be
 * safe for that.
 */
public interface CostSourceService
{
    NameResponse name(CallContext ctx, NameRequest request);

    SupportsResponse supports(CallContext ctx, SupportsRequest request);

    GetActualCostResponse getActualCost(CallContext ctx, GetActualCostRequest request);

    GetProjectedCostResponse getProjectedCost(CallContext ctx, GetProjectedCostRequest request);

    GetPricingSpecResponse getPricingSpec(CallContext ctx, GetPricingSpecRequest request);

    default EstimateCostResponse estimateCost(CallContext ctx, EstimateCostRequest request)
    {
        throw RpcException.unimplemented(CostSourceMethod.ESTIMATE_COST.wireName());
    }

    default GetRecommendationsResponse getRecommendations(CallContext ctx, GetRecommendationsRequest request)
    {
        throw RpcException.unimplemented(CostSourceMethod.GET_RECOMMENDATIONS.wireName());
    }

    default GetBudgetsResponse getBudgets(CallContext ctx, GetBudgetsRequest request)
    {
        throw RpcException.unimplemented(CostSourceMethod.GET_BUDGETS.wireName());
    }
}
