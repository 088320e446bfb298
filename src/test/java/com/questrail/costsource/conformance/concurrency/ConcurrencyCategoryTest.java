package com.questrail.costsource.conformance.concurrency;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.conformance.CategoryRunner;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.SuiteConfig;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.TestStatus;
import com.questrail.costsource.observability.ConformanceWarningEvent;
import com.questrail.costsource.observability.RecordingObservabilitySink;
import com.questrail.costsource.testkit.ConfigurableCostSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConcurrencyCategoryTest {

    private static SuiteConfig.Builder config(ConfigurableCostSource plugin) {
        return SuiteConfig.builder(plugin)
            .withTestTimeout(Duration.ofSeconds(10))
            .withConcurrencyFanOut(10)
            .withAdvancedFanOut(20);
    }

    @Test
    void deterministicNameFanOutReturnsIdenticalResponses() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        List<TestResult> results = CategoryRunner.run(new ConcurrencyCategory(), config(plugin).build());

        TestResult name = CategoryRunner.get(results, "Concurrency_Name_ParallelRequests_Standard");
        assertEquals(TestStatus.PASSED, name.status());
        assertEquals("10 identical responses", name.detail());
        assertEquals(10.0, CategoryRunner.metric(name, "replies"));
        assertEquals(10, plugin.callCount(CostSourceMethod.NAME));

        assertEquals(8, results.size());
        assertEquals(0, CategoryRunner.count(results, TestStatus.FAILED), results::toString);
        assertEquals("10 well-formed responses",
            CategoryRunner.get(results, "Concurrency_GetActualCost_ParallelRequests_Standard").detail());
    }

    @Test
    void divergingRepliesFailAndSkipTheAdvancedProbe() {
        AtomicInteger counter = new AtomicInteger();
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .respondWith(CostSourceMethod.NAME, r -> new NameResponse("plugin-" + counter.incrementAndGet()))
            .build();

        List<TestResult> results = CategoryRunner.run(new ConcurrencyCategory(),
            config(plugin).withLevel(ConformanceLevel.ADVANCED).build());

        TestResult standard = CategoryRunner.get(results, "Concurrency_Name_ParallelRequests_Standard");
        assertEquals(TestStatus.FAILED, standard.status());
        assertEquals("10 distinct responses among 10 identical calls", standard.detail());

        TestResult advanced = CategoryRunner.get(results, "Concurrency_Name_ParallelRequests_Advanced");
        assertEquals(TestStatus.SKIPPED, advanced.status());
        assertEquals(ConformanceLevel.ADVANCED, advanced.level());
        assertEquals("skipped after an earlier probe of Name failed", advanced.detail());
        assertEquals(10, plugin.callCount(CostSourceMethod.NAME));

        TestResult supportsAdvanced = CategoryRunner.get(results, "Concurrency_Supports_ParallelRequests_Advanced");
        assertEquals(TestStatus.PASSED, supportsAdvanced.status());
        assertEquals("20 identical responses", supportsAdvanced.detail());
    }

    @Test
    void missingRaceDetectionIsAWarningOnEveryResult() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        List<TestResult> results = CategoryRunner.run(new ConcurrencyCategory(),
            config(ConfigurableCostSource.conforming()).withObservabilitySink(sink).build());

        assertTrue(results.stream().allMatch(r -> r.warnings().contains(ConcurrencyCategory.RACE_DETECTION_WARNING)));
        List<ConformanceWarningEvent> warnings = sink.eventsOfType(ConformanceWarningEvent.class);
        assertEquals(1, warnings.size());
        assertEquals(TestCategory.CONCURRENCY, warnings.get(0).category());
        assertEquals(ConcurrencyCategory.RACE_DETECTION_WARNING, warnings.get(0).message());
    }

    @Test
    void declaredRaceDetectionDropsTheWarning() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        List<TestResult> results = CategoryRunner.run(new ConcurrencyCategory(),
            config(ConfigurableCostSource.conforming())
                .withRaceDetectionActive(true)
                .withObservabilitySink(sink)
                .build());

        assertTrue(results.stream().allMatch(r -> r.warnings().isEmpty()));
        assertFalse(sink.hasEventOfType(ConformanceWarningEvent.class));
    }

    @Test
    void failingCallsAreCountedAndClassified() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .panic(CostSourceMethod.GET_BUDGETS, "concurrent map writes")
            .build();

        TestResult budgets = CategoryRunner.get(CategoryRunner.run(new ConcurrencyCategory(), config(plugin).build()),
            "Concurrency_GetBudgets_ParallelRequests_Standard");

        assertEquals(TestStatus.FAILED, budgets.status());
        assertEquals(10.0, CategoryRunner.metric(budgets, "errors"));
        assertEquals("10 of 10 calls failed; first: implementation panicked: concurrent map writes",
            budgets.detail());
    }

    @Test
    void slowRepliesAreInconclusive() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .delay(CostSourceMethod.NAME, Duration.ofSeconds(5))
            .build();

        TestResult name = CategoryRunner.get(CategoryRunner.run(new ConcurrencyCategory(),
                config(plugin).withTestTimeout(Duration.ofMillis(200)).withConcurrencyFanOut(4).build()),
            "Concurrency_Name_ParallelRequests_Standard");

        assertEquals(TestStatus.TIMED_OUT, name.status());
    }

    @Test
    void interruptedRunIsCancelledRatherThanFailed() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();

        List<TestResult> results = CategoryRunner.runInterrupted(new ConcurrencyCategory(), config(plugin).build());

        assertEquals(8, results.size());
        assertEquals(0, CategoryRunner.count(results, TestStatus.FAILED), results::toString);
        assertEquals(8, CategoryRunner.count(results, TestStatus.CANCELLED), results::toString);
        TestResult name = CategoryRunner.get(results, "Concurrency_Name_ParallelRequests_Standard");
        assertEquals("CANCELLED: fan-out interrupted", name.detail());
        assertEquals(10.0, CategoryRunner.metric(name, "errors"));
        assertEquals(0, plugin.callCount(CostSourceMethod.NAME));
    }

    @Test
    void unadvertisedMethodIsSkipped() {
        ConfigurableCostSource plugin = ConfigurableCostSource.builder()
            .withConformingDefaults()
            .unconfigure(CostSourceMethod.GET_RECOMMENDATIONS)
            .build();

        TestResult result = CategoryRunner.get(CategoryRunner.run(new ConcurrencyCategory(), config(plugin).build()),
            "Concurrency_GetRecommendations_ParallelRequests_Standard");

        assertEquals(TestStatus.SKIPPED, result.status());
        assertEquals(0, plugin.callCount(CostSourceMethod.GET_RECOMMENDATIONS));
    }
}
