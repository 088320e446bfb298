package com.questrail.costsource.conformance.concurrency;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.harness.CostSourceClient;
import com.questrail.costsource.harness.InProcessHarness;
import com.questrail.costsource.testkit.ConfigurableCostSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class FanOutProbeTest {

    private static final int FAN_OUT = 8;

    private final InProcessHarness harness = InProcessHarness.builder().withWorkerThreads(16).build();

    @AfterEach
    void tearDown() {
        harness.stop();
    }

    @Test
    void callsReachThePluginAtTheSameTime() {
        CountDownLatch arrived = new CountDownLatch(FAN_OUT);
        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .respondWith(CostSourceMethod.NAME, r -> {
                arrived.countDown();
                try {
                    return new NameResponse(arrived.await(5, TimeUnit.SECONDS) ? "parallel" : "serial");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new NameResponse("interrupted");
                }
            })
            .build());
        FanOutProbe probe = new FanOutProbe(client, CostSourceMethod.NAME, new NameRequest(), FAN_OUT,
            Duration.ofSeconds(10));

        FanOutProbe.ProbeResult result = probe.run(ConcurrencyCategory::verifyIdentical);

        assertEquals(ProbeState.VERIFIED, result.state());
        assertEquals(FAN_OUT, result.replies().size());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.replies().stream().allMatch(r -> new NameResponse("parallel").equals(r.response())));
    }

    @Test
    void probeIsSingleUse() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());
        FanOutProbe probe = new FanOutProbe(client, CostSourceMethod.NAME, new NameRequest(), 2,
            Duration.ofSeconds(5));
        assertEquals(ProbeState.IDLE, probe.state());

        probe.run(responses -> Optional.empty());

        assertEquals(ProbeState.VERIFIED, probe.state());
        assertThrows(IllegalStateException.class, () -> probe.run(responses -> Optional.empty()));
    }

    @Test
    void verifierFindingFailsTheProbe() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());
        FanOutProbe probe = new FanOutProbe(client, CostSourceMethod.NAME, new NameRequest(), 3,
            Duration.ofSeconds(5));

        FanOutProbe.ProbeResult result = probe.run(responses -> Optional.of("not good enough"));

        assertEquals(ProbeState.FAILED, result.state());
        assertEquals(Optional.of("not good enough"), result.failure());
    }

    @Test
    void callErrorsFailTheProbeWithoutAFinding() {
        CostSourceClient client = harness.start(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .fail(CostSourceMethod.NAME, StatusCode.UNAVAILABLE, "overloaded")
            .build());
        FanOutProbe probe = new FanOutProbe(client, CostSourceMethod.NAME, new NameRequest(), 3,
            Duration.ofSeconds(5));

        FanOutProbe.ProbeResult result = probe.run(responses -> Optional.empty());

        assertEquals(ProbeState.FAILED, result.state());
        assertTrue(result.failure().isEmpty());
        assertEquals(3, result.errors().size());
        assertEquals(StatusCode.UNAVAILABLE, result.errors().get(0).code());
    }

    @Test
    void interruptedCallerGetsCancelledReplies() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());
        FanOutProbe probe = new FanOutProbe(client, CostSourceMethod.NAME, new NameRequest(), 3,
            Duration.ofSeconds(5));

        FanOutProbe.ProbeResult result;
        Thread.currentThread().interrupt();
        try {
            result = probe.run(responses -> Optional.empty());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(ProbeState.FAILED, result.state());
        assertTrue(result.failure().isEmpty());
        assertEquals(3, result.errors().size());
        assertTrue(result.errors().stream().allMatch(e -> e.code() == StatusCode.CANCELLED));
    }

    @Test
    void fanOutMustBePositive() {
        CostSourceClient client = harness.start(ConfigurableCostSource.conforming());

        assertThrows(IllegalArgumentException.class, () -> new FanOutProbe(client, CostSourceMethod.NAME,
            new NameRequest(), 0, Duration.ofSeconds(1)));
    }

    @Test
    void statesOnlyMoveForward() {
        assertTrue(ProbeState.IDLE.canMoveTo(ProbeState.DISPATCHING));
        assertTrue(ProbeState.DISPATCHING.canMoveTo(ProbeState.COLLECTING));
        assertTrue(ProbeState.COLLECTING.canMoveTo(ProbeState.FAILED));
        assertFalse(ProbeState.IDLE.canMoveTo(ProbeState.VERIFIED));
        assertFalse(ProbeState.VERIFIED.canMoveTo(ProbeState.FAILED));
        assertFalse(ProbeState.COLLECTING.canMoveTo(ProbeState.DISPATCHING));
        assertTrue(ProbeState.VERIFIED.isTerminal());
        assertFalse(ProbeState.COLLECTING.isTerminal());
    }
}
