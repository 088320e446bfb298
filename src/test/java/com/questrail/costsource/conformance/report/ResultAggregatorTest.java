package com.questrail.costsource.conformance.report;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.TestStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class ResultAggregatorTest {

    private static TestResult result(String name, TestCategory category, ConformanceLevel level, TestStatus status) {
        return TestResult.builder(name, category)
            .method(CostSourceMethod.NAME)
            .level(level)
            .status(status)
            .detail(status == TestStatus.FAILED ? "broken" : "")
            .build();
    }

    private static TestResult passed(String name, TestCategory category) {
        return result(name, category, category.minimumLevel(), TestStatus.PASSED);
    }

    private static List<TestResult> allPassing() {
        return List.of(
            passed("SpecValidation_Name", TestCategory.SPEC_VALIDATION),
            passed("RPCCorrectness_NameRPC", TestCategory.RPC_CORRECTNESS),
            passed("Performance_NameLatency", TestCategory.PERFORMANCE),
            passed("Concurrency_Name_ParallelRequests_Standard", TestCategory.CONCURRENCY));
    }

    private static ConformanceResult aggregate(ConformanceLevel requested, List<TestResult> results) {
        return ResultAggregator.aggregate("p", requested, results, Duration.ofMillis(42));
    }

    @Test
    void everythingPassingAchievesTheRequestedLevel() {
        ConformanceResult result = aggregate(ConformanceLevel.STANDARD, allPassing());

        assertEquals(ConformanceLevel.STANDARD, result.achievedLevel());
        assertTrue(result.certifiedAt(ConformanceLevel.BASIC));
        assertFalse(result.certifiedAt(ConformanceLevel.ADVANCED));
        assertEquals(4, result.categories().size());
        assertEquals(4, result.totalPassed());
        assertEquals(ConformanceResult.REPORT_VERSION, result.reportVersion());
    }

    @Test
    void achievedLevelNeverExceedsTheRequestedOne() {
        assertEquals(ConformanceLevel.BASIC, aggregate(ConformanceLevel.BASIC, allPassing()).achievedLevel());
    }

    @Test
    void specFailureLeavesThePluginBelowBasic() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("SpecValidation_Supports", TestCategory.SPEC_VALIDATION, ConformanceLevel.BASIC,
            TestStatus.FAILED));

        ConformanceResult result = aggregate(ConformanceLevel.STANDARD, results);

        assertNull(result.achievedLevel());
        assertTrue(result.achieved().isEmpty());
        assertFalse(result.certifiedAt(ConformanceLevel.BASIC));
    }

    @Test
    void performanceFailureCapsTheLevelAtBasic() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("Performance_SupportsLatency", TestCategory.PERFORMANCE, ConformanceLevel.STANDARD,
            TestStatus.FAILED));

        assertEquals(ConformanceLevel.BASIC, aggregate(ConformanceLevel.ADVANCED, results).achievedLevel());
    }

    @Test
    void advancedOnlyFailureStillCertifiesStandard() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("Performance_NameLatency_Advanced", TestCategory.PERFORMANCE, ConformanceLevel.ADVANCED,
            TestStatus.FAILED));

        ConformanceResult result = aggregate(ConformanceLevel.ADVANCED, results);

        assertEquals(ConformanceLevel.STANDARD, result.achievedLevel());
        CategoryResult perf = result.category(TestCategory.PERFORMANCE).orElseThrow();
        assertFalse(perf.satisfied());
        assertTrue(perf.satisfiedAt(ConformanceLevel.STANDARD));
        assertFalse(perf.satisfiedAt(ConformanceLevel.ADVANCED));
    }

    @Test
    void unattemptedRequiredCategoryBlocksItsLevel() {
        List<TestResult> results = allPassing().stream()
            .filter(r -> r.category() != TestCategory.CONCURRENCY)
            .toList();

        ConformanceResult result = aggregate(ConformanceLevel.STANDARD, results);

        assertEquals(ConformanceLevel.BASIC, result.achievedLevel());
        CategoryResult concurrency = result.category(TestCategory.CONCURRENCY).orElseThrow();
        assertFalse(concurrency.attempted());
        assertEquals(0, concurrency.total());
    }

    @Test
    void inconclusiveAndSkippedResultsDoNotBlock() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("RPCCorrectness_SupportsRPC", TestCategory.RPC_CORRECTNESS, ConformanceLevel.BASIC,
            TestStatus.TIMED_OUT));
        results.add(result("RPCCorrectness_EstimateCostRPC", TestCategory.RPC_CORRECTNESS, ConformanceLevel.BASIC,
            TestStatus.SKIPPED));
        results.add(result("Concurrency_Supports_ParallelRequests_Standard", TestCategory.CONCURRENCY,
            ConformanceLevel.STANDARD, TestStatus.CANCELLED));

        ConformanceResult result = aggregate(ConformanceLevel.STANDARD, results);

        assertEquals(ConformanceLevel.STANDARD, result.achievedLevel());
        assertEquals(2, result.totalInconclusive());
        assertEquals(1, result.totalSkipped());
        CategoryResult rpc = result.category(TestCategory.RPC_CORRECTNESS).orElseThrow();
        assertEquals(1, rpc.timedOut());
        assertEquals(3, rpc.total());
    }

    @Test
    void categoryWithOnlyInconclusiveResultsEarnsNothing() {
        List<TestResult> results = new ArrayList<>(allPassing().stream()
            .filter(r -> r.category() != TestCategory.SPEC_VALIDATION)
            .toList());
        results.add(result("SpecValidation_GetActualCost", TestCategory.SPEC_VALIDATION, ConformanceLevel.BASIC,
            TestStatus.TIMED_OUT));
        results.add(result("SpecValidation_EstimateCost", TestCategory.SPEC_VALIDATION, ConformanceLevel.BASIC,
            TestStatus.SKIPPED));

        ConformanceResult result = aggregate(ConformanceLevel.ADVANCED, results);

        assertNull(result.achievedLevel());
        CategoryResult spec = result.category(TestCategory.SPEC_VALIDATION).orElseThrow();
        assertTrue(spec.attempted());
        assertFalse(spec.satisfied());
        assertFalse(spec.satisfiedAt(ConformanceLevel.BASIC));
    }

    @Test
    void advancedNeedsAPassingAdvancedCheck() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("Performance_NameLatency_Advanced", TestCategory.PERFORMANCE, ConformanceLevel.ADVANCED,
            TestStatus.TIMED_OUT));
        results.add(result("Concurrency_Name_ParallelRequests_Advanced", TestCategory.CONCURRENCY,
            ConformanceLevel.ADVANCED, TestStatus.PASSED));

        ConformanceResult result = aggregate(ConformanceLevel.ADVANCED, results);

        assertEquals(ConformanceLevel.STANDARD, result.achievedLevel());
        CategoryResult perf = result.category(TestCategory.PERFORMANCE).orElseThrow();
        assertTrue(perf.satisfiedAt(ConformanceLevel.STANDARD));
        assertFalse(perf.satisfiedAt(ConformanceLevel.ADVANCED));
    }

    @Test
    void aggregationIgnoresInputOrder() {
        List<TestResult> results = new ArrayList<>(allPassing());
        results.add(result("Performance_SupportsLatency", TestCategory.PERFORMANCE, ConformanceLevel.STANDARD,
            TestStatus.FAILED));
        results.add(passed("RPCCorrectness_SupportsRPC", TestCategory.RPC_CORRECTNESS));
        ConformanceResult expected = aggregate(ConformanceLevel.STANDARD, results);

        List<TestResult> shuffled = new ArrayList<>(results);
        Collections.shuffle(shuffled, new Random(7));
        Collections.reverse(results);

        assertEquals(expected, aggregate(ConformanceLevel.STANDARD, shuffled));
        assertEquals(expected, aggregate(ConformanceLevel.STANDARD, results));
        assertEquals("RPCCorrectness_NameRPC",
            expected.category(TestCategory.RPC_CORRECTNESS).orElseThrow().results().get(0).name());
    }

    @Test
    void summaryNamesLevelsCountsAndMissingCategories() {
        List<TestResult> results = List.of(
            passed("SpecValidation_Name", TestCategory.SPEC_VALIDATION),
            passed("RPCCorrectness_NameRPC", TestCategory.RPC_CORRECTNESS),
            result("Performance_NameLatency", TestCategory.PERFORMANCE, ConformanceLevel.STANDARD,
                TestStatus.FAILED));

        ConformanceResult result = aggregate(ConformanceLevel.STANDARD, results);

        assertEquals("Plugin 'p' achieved Basic (requested Standard): 3 tests, 2 passed, 1 failed, 0 skipped; "
            + "not attempted: concurrency", result.summary());
    }

    @Test
    void summaryForAPluginBelowBasicMentionsInconclusiveTests() {
        List<TestResult> results = List.of(
            result("SpecValidation_Name", TestCategory.SPEC_VALIDATION, ConformanceLevel.BASIC, TestStatus.FAILED),
            result("RPCCorrectness_NameRPC", TestCategory.RPC_CORRECTNESS, ConformanceLevel.BASIC,
                TestStatus.TIMED_OUT));

        ConformanceResult result = aggregate(ConformanceLevel.BASIC, results);

        assertEquals("Plugin 'p' did not achieve Basic (requested Basic): 2 tests, 0 passed, 1 failed, 0 skipped, "
            + "1 timed out or cancelled; not attempted: performance, concurrency", result.summary());
    }
}
