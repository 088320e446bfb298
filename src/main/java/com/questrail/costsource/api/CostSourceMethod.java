package com.questrail.costsource.api;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * CostSourceMethod
 * -----------------------------------------------------------------------------
 * Descriptor for each method of {@link CostSourceService}: its wire name,
 * message types, whether it is required, and the capability key under which
 * an optional method is advertised.
 *
 * <p>The server dispatcher uses {@link #invoke} to route a decoded request to
 * the implementation without reflection.</p>
 */
public enum CostSourceMethod
{
    NAME("Name", NameRequest.class, NameResponse.class, null,
            (s, c, r) -> s.name(c, (NameRequest) r)),
    SUPPORTS("Supports", SupportsRequest.class, SupportsResponse.class, null,
            (s, c, r) -> s.supports(c, (SupportsRequest) r)),
    GET_ACTUAL_COST("GetActualCost", GetActualCostRequest.class, GetActualCostResponse.class, null,
            (s, c, r) -> s.getActualCost(c, (GetActualCostRequest) r)),
    GET_PROJECTED_COST("GetProjectedCost", GetProjectedCostRequest.class, GetProjectedCostResponse.class, null,
            (s, c, r) -> s.getProjectedCost(c, (GetProjectedCostRequest) r)),
    GET_PRICING_SPEC("GetPricingSpec", GetPricingSpecRequest.class, GetPricingSpecResponse.class, null,
            (s, c, r) -> s.getPricingSpec(c, (GetPricingSpecRequest) r)),
    ESTIMATE_COST("EstimateCost", EstimateCostRequest.class, EstimateCostResponse.class, "estimate_cost",
            (s, c, r) -> s.estimateCost(c, (EstimateCostRequest) r)),
    GET_RECOMMENDATIONS("GetRecommendations", GetRecommendationsRequest.class, GetRecommendationsResponse.class, "recommendations",
            (s, c, r) -> s.getRecommendations(c, (GetRecommendationsRequest) r)),
    GET_BUDGETS("GetBudgets", GetBudgetsRequest.class, GetBudgetsResponse.class, "budgets",
            (s, c, r) -> s.getBudgets(c, (GetBudgetsRequest) r));

    @FunctionalInterface
    private interface Invoker
    {
        Object invoke(CostSourceService service, CallContext ctx, Object request);
    }

    private final String wireName;
    private final Class<?> requestType;
    private final Class<?> responseType;
    private final String capabilityKey;
    private final Invoker invoker;

    CostSourceMethod(String wireName, Class<?> requestType, Class<?> responseType,
                     String capabilityKey, Invoker invoker)
    {
        this.wireName = wireName;
        this.requestType = requestType;
        this.responseType = responseType;
        this.capabilityKey = capabilityKey;
        this.invoker = invoker;
    }

    public String wireName()
    {
        return wireName;
    }

    public Class<?> requestType()
    {
        return requestType;
    }

    public Class<?> responseType()
    {
        return responseType;
    }

    /**
     * Capability key for optional methods; {@code null} for required ones.
     */
    public String capabilityKey()
    {
        return capabilityKey;
    }

    public boolean isOptional()
    {
        return capabilityKey != null;
    }

    public Object invoke(CostSourceService service, CallContext ctx, Object request)
    {
        Objects.requireNonNull(service, "service");
        if (request != null && !requestType.isInstance(request)) {
            throw new IllegalArgumentException(
                    wireName + " expects " + requestType.getSimpleName()
                            + " but got " + request.getClass().getSimpleName());
        }
        return invoker.invoke(service, ctx, request);
    }

    public static Optional<CostSourceMethod> fromWireName(String wireName)
    {
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(wireName))
                .findFirst();
    }
}
