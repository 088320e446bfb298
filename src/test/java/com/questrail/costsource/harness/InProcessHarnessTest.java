package com.questrail.costsource.harness;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.GetProjectedCostRequest;
import com.questrail.costsource.api.GetProjectedCostResponse;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.ResourceDescriptor;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.api.SupportsRequest;
import com.questrail.costsource.api.SupportsResponse;
import com.questrail.costsource.rpc.CallOptions;
import com.questrail.costsource.rpc.CallStats;
import com.questrail.costsource.rpc.CancellationSignal;
import com.questrail.costsource.testkit.CannedResponses;
import com.questrail.costsource.testkit.ConfigurableCostSource;
import com.questrail.costsource.transport.FakeFrameEndpoint;
import com.questrail.costsource.transport.FrameEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class InProcessHarnessTest {

    private final InProcessHarness harness = InProcessHarness.builder()
        .withDefaultTimeout(Duration.ofSeconds(5))
        .withWorkerThreads(8)
        .build();

    @AfterEach
    void tearDown() {
        harness.stop();
    }

    @Test
    void callsCrossTheInMemoryChannel() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());

        assertEquals(new NameResponse(CannedResponses.PLUGIN_NAME), client.name(new NameRequest()));

        SupportsResponse supports = client.supports(new SupportsRequest(CannedResponses.TEST_RESOURCE));
        assertTrue(supports.supported());
        assertEquals(Boolean.TRUE, supports.capabilities().get("budgets"));

        GetProjectedCostResponse projected = client.getProjectedCost(
            new GetProjectedCostRequest(CannedResponses.TEST_RESOURCE));
        assertEquals("USD", projected.currency());
        assertTrue(harness.isStarted());
    }

    @Test
    void secondBindingIsRefused() {
        harness.start(ConfigurableCostSource.conforming());

        assertThrows(HarnessException.class, () -> harness.start(ConfigurableCostSource.conforming()));
    }

    @Test
    void stopIsIdempotentAndLeavesTheClientUnavailable() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());

        harness.stop();
        harness.stop();

        assertFalse(harness.isStarted());
        RpcException e = assertThrows(RpcException.class, () -> client.name(new NameRequest()));
        assertEquals(StatusCode.UNAVAILABLE, e.code());
    }

    @Test
    void harnessCanBeReboundAfterStop() {
        harness.start(ConfigurableCostSource.conforming());
        harness.stop();

        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .withName("second")
            .build());

        assertEquals("second", client.name(new NameRequest()).name());
    }

    @Test
    void panicBecomesAnInternalFaultAndTheChannelSurvives() {
        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .panic(CostSourceMethod.GET_PROJECTED_COST, "nil pointer")
            .build());

        RpcException e = assertThrows(RpcException.class,
            () -> client.getProjectedCost(new GetProjectedCostRequest(CannedResponses.TEST_RESOURCE)));

        assertEquals(StatusCode.INTERNAL, e.code());
        assertTrue(e.isImplementationFault());
        assertEquals("implementation panicked: nil pointer", e.getMessage());
        assertEquals(CannedResponses.PLUGIN_NAME, client.name(new NameRequest()).name());
    }

    @Test
    void hugeErrorMessagesAreTruncatedAndTheChannelSurvives() {
        String huge = "x".repeat(5 * 1024 * 1024);
        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .fail(CostSourceMethod.NAME, StatusCode.INVALID_ARGUMENT, huge)
            .panic(CostSourceMethod.GET_PROJECTED_COST, huge)
            .build());

        RpcException rejected = assertThrows(RpcException.class, () -> client.name(new NameRequest()));
        assertEquals(StatusCode.INVALID_ARGUMENT, rejected.code());
        assertTrue(rejected.getMessage().endsWith("chars]"));

        RpcException panicked = assertThrows(RpcException.class,
            () -> client.getProjectedCost(new GetProjectedCostRequest(CannedResponses.TEST_RESOURCE)));
        assertEquals(StatusCode.INTERNAL, panicked.code());
        assertTrue(panicked.isImplementationFault());
        assertTrue(panicked.getMessage().startsWith("implementation panicked: xxx"));

        assertTrue(client.supports(new SupportsRequest(CannedResponses.TEST_RESOURCE)).supported());
    }

    @Test
    void slowCallHitsItsDeadline() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .delay(CostSourceMethod.NAME, Duration.ofSeconds(10))
            .build();
        CostSourceClient client = harness.start(plugin);

        long start = System.nanoTime();
        RpcException e = assertThrows(RpcException.class,
            () -> client.name(new NameRequest(), CallOptions.withTimeout(Duration.ofMillis(100))));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(StatusCode.DEADLINE_EXCEEDED, e.code());
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + "ms");
    }

    @Test
    void cancellationSignalEndsAnOutstandingCall() throws Exception {
        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .delay(CostSourceMethod.NAME, Duration.ofSeconds(10))
            .build());
        CancellationSignal signal = new CancellationSignal();

        CompletableFuture<NameResponse> call = CompletableFuture.supplyAsync(
            () -> client.name(new NameRequest(), CallOptions.defaults().withCancellation(signal)));
        Thread.sleep(50);
        signal.cancel();

        ExecutionException e = assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
        RpcException rpc = assertInstanceOf(RpcException.class, e.getCause());
        assertEquals(StatusCode.CANCELLED, rpc.code());
    }

    @Test
    void oversizeRequestNeverReachesThePlugin() {
        InProcessHarness small = InProcessHarness.builder().withMaxMessageBytes(256).build();
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();
        try (small) {
            CostSourceClient client = small.start(plugin);
            ResourceDescriptor bloated = new ResourceDescriptor("aws", "ec2", "t3.micro", "us-east-1",
                Map.of("padding", "x".repeat(1024)));

            RpcException e = assertThrows(RpcException.class,
                () -> client.supports(new SupportsRequest(bloated)));

            assertEquals(StatusCode.RESOURCE_EXHAUSTED, e.code());
            assertEquals(0, plugin.callCount(CostSourceMethod.SUPPORTS));
        }
    }

    @Test
    void oversizeResponseIsRejectedOnTheServer() {
        InProcessHarness small = InProcessHarness.builder().withMaxMessageBytes(256).build();
        try (small) {
            CostSourceClient client = small.start(ConfigurableCostSource.builder()
                .withConformingDefaults()
                .withName("n".repeat(1024))
                .build());

            RpcException e = assertThrows(RpcException.class, () -> client.name(new NameRequest()));

            assertEquals(StatusCode.RESOURCE_EXHAUSTED, e.code());
            assertTrue(e.getMessage().startsWith("response rejected"), e.getMessage());
        }
    }

    @Test
    void channelFailureIsAHarnessException() {
        List<FakeFrameEndpoint> created = new ArrayList<>();
        InProcessHarness broken = InProcessHarness.builder()
            .withEndpointFactory(new EndpointFactory() {
                @Override
                public FrameEndpoint server(String channelId, int maxFrameBytes) {
                    FakeFrameEndpoint e = new FakeFrameEndpoint().failOnStart("address in use");
                    created.add(e);
                    return e;
                }

                @Override
                public FrameEndpoint client(String channelId, int maxFrameBytes) {
                    FakeFrameEndpoint e = new FakeFrameEndpoint();
                    created.add(e);
                    return e;
                }
            })
            .build();

        HarnessException e = assertThrows(HarnessException.class,
            () -> broken.start(ConfigurableCostSource.conforming()));

        assertTrue(e.getMessage().startsWith("failed to establish in-memory channel"));
        assertFalse(broken.isStarted());
        assertEquals(2, created.size());
        assertFalse(created.get(1).isStarted());
    }

    @Test
    void everyCallReportsItsStats() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());
        AtomicReference<CallStats> stats = new AtomicReference<>();

        client.name(new NameRequest(), CallOptions.defaults().withStatsSink(stats::set));

        CallStats s = stats.get();
        assertEquals(CostSourceMethod.NAME, s.method());
        assertEquals(StatusCode.OK, s.status());
        assertTrue(s.responseBytes() > 0);
        assertTrue(s.clientNanos() >= s.serverNanos());
    }

    @Test
    void invalidBuilderSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> InProcessHarness.builder().withWorkerThreads(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> InProcessHarness.builder().withDefaultTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> InProcessHarness.builder().withMaxMessageBytes(-1).build());
    }
}
