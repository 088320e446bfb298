package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.EstimateCostRequest;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetBudgetsRequest;
import com.questrail.costsource.api.GetPricingSpecRequest;
import com.questrail.costsource.api.GetProjectedCostRequest;
import com.questrail.costsource.api.GetRecommendationsRequest;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.ResourceDescriptor;
import com.questrail.costsource.api.SupportsRequest;

import java.time.Instant;
import java.util.Map;

/**
 * Requests the conformance checks send.
 *
 * <p>All values are fixed so that repeated runs issue identical calls.</p>
 */
public final class ConformanceFixtures
{
    /** A widely priced resource every cloud plugin is expected to know. */
    public static final ResourceDescriptor STANDARD_RESOURCE = new ResourceDescriptor(
            "aws", "ec2", "t3.micro", "us-east-1", Map.of("environment", "test"));

    /** A provider no plugin is expected to support. */
    public static final ResourceDescriptor UNSUPPORTED_RESOURCE =
            ResourceDescriptor.of("unsupported-provider", "unknown-resource", "", "");

    public static final String RESOURCE_ID = "i-0123456789abcdef0";

    public static final Instant RANGE_START = Instant.parse("2024-01-01T00:00:00Z");
    public static final Instant RANGE_END = Instant.parse("2024-01-02T00:00:00Z");

    public static final int PAGE_SIZE = 10;

    private ConformanceFixtures()
    {
    }

    /**
     * Minimal well-formed request for {@code method}.
     */
    public static Object validRequest(CostSourceMethod method)
    {
        return switch (method) {
            case NAME -> new NameRequest();
            case SUPPORTS -> new SupportsRequest(STANDARD_RESOURCE);
            case GET_ACTUAL_COST -> new GetActualCostRequest(RESOURCE_ID, RANGE_START, RANGE_END);
            case GET_PROJECTED_COST -> new GetProjectedCostRequest(STANDARD_RESOURCE);
            case GET_PRICING_SPEC -> new GetPricingSpecRequest(STANDARD_RESOURCE);
            case ESTIMATE_COST -> new EstimateCostRequest(STANDARD_RESOURCE, Map.of("instance_count", "1"));
            case GET_RECOMMENDATIONS -> new GetRecommendationsRequest(null, PAGE_SIZE, null);
            case GET_BUDGETS -> new GetBudgetsRequest(null, true);
        };
    }

    /**
     * Request for {@code method} naming {@code resource}, or {@code null}
     * when the method takes no resource descriptor.
     */
    public static Object requestFor(CostSourceMethod method, ResourceDescriptor resource)
    {
        return switch (method) {
            case SUPPORTS -> new SupportsRequest(resource);
            case GET_PROJECTED_COST -> new GetProjectedCostRequest(resource);
            case GET_PRICING_SPEC -> new GetPricingSpecRequest(resource);
            case ESTIMATE_COST -> new EstimateCostRequest(resource, Map.of());
            default -> null;
        };
    }

    public static boolean takesResource(CostSourceMethod method)
    {
        return switch (method) {
            case SUPPORTS, GET_PROJECTED_COST, GET_PRICING_SPEC, ESTIMATE_COST -> true;
            default -> false;
        };
    }
}
