package com.questrail.costsource.testkit;

import com.questrail.costsource.api.CallContext;
import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.EstimateCostRequest;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetActualCostResponse;
import com.questrail.costsource.api.GetBudgetsRequest;
import com.questrail.costsource.api.GetProjectedCostRequest;
import com.questrail.costsource.api.GetRecommendationsRequest;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.ResourceDescriptor;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.api.SupportsRequest;
import com.questrail.costsource.api.SupportsResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigurableCostSourceTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final ResourceDescriptor UNKNOWN = ResourceDescriptor.of("oracle", "vm", "small", "eu");

    private final CallContext ctx = CallContext.background();

    @Test
    void conformingDoubleAdvertisesEveryOptionalMethod() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        SupportsResponse supports = plugin.supports(ctx, new SupportsRequest(CannedResponses.TEST_RESOURCE));

        assertTrue(supports.supported());
        assertEquals(Map.of("estimate_cost", true, "recommendations", true, "budgets", true),
            supports.capabilities());
    }

    @Test
    void unconfiguredOptionalMethodIsUnimplementedAndNotAdvertised() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .unconfigure(CostSourceMethod.GET_BUDGETS)
            .build();

        assertFalse(plugin.capabilities().get("budgets"));
        assertFalse(plugin.isConfigured(CostSourceMethod.GET_BUDGETS));
        RpcException e = assertThrows(RpcException.class,
            () -> plugin.getBudgets(ctx, new GetBudgetsRequest(null, false)));
        assertEquals(StatusCode.UNIMPLEMENTED, e.code());
    }

    @Test
    void supportsWithoutAdvertisementIsUnimplemented() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder().withName("bare").build();

        RpcException e = assertThrows(RpcException.class,
            () -> plugin.supports(ctx, new SupportsRequest(CannedResponses.TEST_RESOURCE)));
        assertEquals(StatusCode.UNIMPLEMENTED, e.code());
        assertEquals("bare", plugin.name(ctx, new NameRequest()).name());
    }

    @Test
    void unknownProviderIsDeclinedBySupportsAndNotFoundElsewhere() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        SupportsResponse supports = plugin.supports(ctx, new SupportsRequest(UNKNOWN));
        assertFalse(supports.supported());
        assertEquals("provider 'oracle' is not supported", supports.reason());

        RpcException e = assertThrows(RpcException.class,
            () -> plugin.getProjectedCost(ctx, new GetProjectedCostRequest(UNKNOWN)));
        assertEquals(StatusCode.NOT_FOUND, e.code());

        RpcException estimate = assertThrows(RpcException.class,
            () -> plugin.estimateCost(ctx, new EstimateCostRequest(UNKNOWN, Map.of())));
        assertEquals(StatusCode.NOT_FOUND, estimate.code());
    }

    @Test
    void actualCostRangesAreValidated() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        assertEquals(StatusCode.INVALID_ARGUMENT, assertThrows(RpcException.class, () -> plugin.getActualCost(ctx,
            new GetActualCostRequest("", START, START.plusSeconds(3600)))).code());
        assertEquals(StatusCode.INVALID_ARGUMENT, assertThrows(RpcException.class, () -> plugin.getActualCost(ctx,
            new GetActualCostRequest("i-1", START.plusSeconds(3600), START))).code());
        assertEquals(StatusCode.INVALID_ARGUMENT, assertThrows(RpcException.class, () -> plugin.getActualCost(ctx,
            new GetActualCostRequest("i-1", START, START))).code());
        assertEquals(StatusCode.INVALID_ARGUMENT, assertThrows(RpcException.class, () -> plugin.getActualCost(ctx,
            new GetActualCostRequest("i-1", null, START))).code());
    }

    @Test
    void actualCostReturnsOneResultPerDay() {
        GetActualCostResponse response = ConfigurableCostSource.conforming().getActualCost(ctx,
            new GetActualCostRequest("i-1", START, START.plus(Duration.ofDays(3))));

        assertEquals(3, response.results().size());
        assertEquals(START.plus(Duration.ofDays(2)), response.results().get(2).timestamp());
    }

    @Test
    void negativePageSizeIsRejected() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        RpcException e = assertThrows(RpcException.class,
            () -> plugin.getRecommendations(ctx, new GetRecommendationsRequest("aws", -1, "")));

        assertEquals(StatusCode.INVALID_ARGUMENT, e.code());
    }

    @Test
    void validationCanBeDisabled() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .withRequestValidation(false)
            .build();

        assertTrue(plugin.supports(ctx, new SupportsRequest(UNKNOWN)).supported());
        assertEquals(2, plugin.getRecommendations(ctx, new GetRecommendationsRequest("aws", -1, ""))
            .recommendations().size());
    }

    @Test
    void injectedFaultIsNotAStatus() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .panic(CostSourceMethod.NAME, "boom")
            .build();

        InjectedFault fault = assertThrows(InjectedFault.class, () -> plugin.name(ctx, new NameRequest()));
        assertEquals("boom", fault.getMessage());
    }

    @Test
    void callsAreRecordedInArrivalOrder() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        plugin.name(ctx, new NameRequest());
        plugin.supports(ctx, new SupportsRequest(CannedResponses.TEST_RESOURCE));
        plugin.name(ctx, new NameRequest());

        assertEquals(3, plugin.recordedCalls().size());
        assertEquals(2, plugin.callCount(CostSourceMethod.NAME));
        assertEquals(1, plugin.recordedCalls().get(1).sequence());
        assertEquals(CostSourceMethod.SUPPORTS, plugin.recordedCalls().get(1).method());
        assertEquals(CannedResponses.TEST_RESOURCE,
            plugin.requestsFor(CostSourceMethod.SUPPORTS, SupportsRequest.class).get(0).resource());
    }

    @Test
    void rejectedCallsAreStillRecorded() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        assertThrows(RpcException.class, () -> plugin.getProjectedCost(ctx, null));

        assertEquals(1, plugin.callCount(CostSourceMethod.GET_PROJECTED_COST));
        assertNull(plugin.requestsFor(CostSourceMethod.GET_PROJECTED_COST, GetProjectedCostRequest.class).get(0));
    }

    @Test
    void mismatchedCannedResponseIsRefusedAtBuildTime() {
        ConfigurableCostSource.Builder builder = ConfigurableCostSource.builder();

        assertThrows(IllegalArgumentException.class,
            () -> builder.respond(CostSourceMethod.SUPPORTS, new NameResponse("wrong")));
    }

    @Test
    void mismatchedComputedResponseFailsTheCall() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .respondWith(CostSourceMethod.NAME, r -> SupportsResponse.supported(Map.of()))
            .build();

        assertThrows(IllegalStateException.class, () -> plugin.name(ctx, new NameRequest()));
    }

    @Test
    void delayHonoursTheCallDeadline() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .delay(CostSourceMethod.NAME, Duration.ofSeconds(10))
            .build();

        RpcException e = assertThrows(RpcException.class,
            () -> plugin.name(CallContext.withTimeout(Duration.ofMillis(30)), new NameRequest()));

        assertEquals(StatusCode.DEADLINE_EXCEEDED, e.code());
    }
}
