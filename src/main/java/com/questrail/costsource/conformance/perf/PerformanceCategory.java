package com.questrail.costsource.conformance.perf;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.conformance.CallOutcomes;
import com.questrail.costsource.conformance.CategoryContext;
import com.questrail.costsource.conformance.ConformanceCategory;
import com.questrail.costsource.conformance.ConformanceFixtures;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.SuiteConfig;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.TestStatus;
import com.questrail.costsource.rpc.AllocationMeter;
import com.questrail.costsource.rpc.CallOptions;
import com.questrail.costsource.rpc.CallStats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PerformanceCategory
 * =============================================================================
 * Measures latency and server-side allocation per method and compares the
 * means against the {@link PerformanceBaseline} table.
 *
 * <h2>Measurement</h2>
 * For every advertised method: {@code warmupIterations} discarded calls, then
 * {@code measuredIterations} timed calls. Latency is taken on the monotonic
 * clock around each client call; allocation is what the server measured on
 * its worker thread while the implementation ran.
 *
 * <h2>Verdict</h2>
 * With tolerance {@code t}, a mean above {@code ceiling x (1 + t)} fails and a
 * mean above {@code ceiling x (1 - t)} passes with a warning. Allocation means
 * are judged the same way. Raw numbers are attached as metrics whatever the
 * outcome, so baselines can be recalibrated for the environment.
 *
 * <p>Advanced runs add {@code Performance_<Method>Latency_Advanced}, judged
 * from the same samples against the stricter advanced ceiling and gating only
 * the Advanced level.</p>
 *
 * <h2>Calls that never answer</h2>
 * A call that hits its deadline has no latency to average, but it has run for
 * at least the time it was given. When that time already exceeds
 * {@code ceiling x (1 + t)} the method fails with the elapsed time as its
 * latency. A deadline shorter than the limit, which the budget can impose,
 * leaves the method timed out.
 *
 * <h2>Budget</h2>
 * The whole category is bounded by {@code performanceBudget}. Each call's
 * timeout is capped by what is left of it, and methods not reached before it
 * runs out are reported as timed out.
 */
public final class PerformanceCategory implements ConformanceCategory
{
    @Override
    public TestCategory category()
    {
        return TestCategory.PERFORMANCE;
    }

    @Override
    public List<TestResult> run(CategoryContext context)
    {
        SuiteConfig config = context.config();
        Map<CostSourceMethod, PerformanceBaseline> baselines = config.baselines();
        boolean advanced = context.level() == ConformanceLevel.ADVANCED;

        long startedAt = context.clock().nowNanos();
        long budgetNanos = config.performanceBudget().toNanos();

        List<TestResult> results = new ArrayList<>();
        for (CostSourceMethod method : CostSourceMethod.values()) {
            String name = testName(method);
            String advancedName = name + "_Advanced";

            if (!context.advertises(method)) {
                results.add(CategoryContext.notAdvertised(name, category(), method));
                if (advanced) {
                    results.add(withLevel(CategoryContext.notAdvertised(advancedName, category(), method)));
                }
                continue;
            }

            Measurement m = measure(context, method, startedAt, budgetNanos);
            PerformanceBaseline baseline = baselines.get(method);
            results.add(verdict(context, name, method, ConformanceLevel.STANDARD, m,
                    baseline.standardLatency(), baseline.allocationBytes()));
            if (advanced) {
                results.add(verdict(context, advancedName, method, ConformanceLevel.ADVANCED, m,
                        baseline.advancedLatency(), baseline.allocationBytes()));
            }
        }
        return results;
    }

    static String testName(CostSourceMethod method)
    {
        return "Performance_" + method.wireName() + "Latency";
    }

    private Measurement measure(CategoryContext context, CostSourceMethod method, long startedAt, long budgetNanos)
    {
        SuiteConfig config = context.config();
        Object request = ConformanceFixtures.validRequest(method);
        long begin = context.clock().nowNanos();

        for (int i = 0; i < config.warmupIterations(); i++) {
            Measurement failed = timedCall(context, method, request, startedAt, budgetNanos, null, begin);
            if (failed != null) {
                return failed;
            }
        }

        int n = config.measuredIterations();
        long[] latencies = new long[n];
        long[] allocations = new long[n];
        for (int i = 0; i < n; i++) {
            long[] stats = new long[]{AllocationMeter.UNAVAILABLE};
            long t0 = context.clock().nowNanos();
            Measurement failed = timedCall(context, method, request, startedAt, budgetNanos, stats, begin);
            if (failed != null) {
                return failed;
            }
            latencies[i] = context.clock().elapsedSince(t0);
            allocations[i] = stats[0];
        }
        return Measurement.of(LatencyStats.of(latencies), allocations,
                Duration.ofNanos(context.clock().elapsedSince(begin)));
    }

    /**
     * One call; returns a terminal measurement when the method cannot be
     * measured any further.
     */
    private Measurement timedCall(CategoryContext context, CostSourceMethod method, Object request, long startedAt,
                                  long budgetNanos, long[] allocationOut, long begin)
    {
        long remaining = budgetNanos - context.clock().elapsedSince(startedAt);
        if (remaining <= 0) {
            return Measurement.outcome(TestStatus.TIMED_OUT,
                    "performance budget of " + context.config().performanceBudget() + " exhausted",
                    Duration.ofNanos(context.clock().elapsedSince(begin)));
        }

        Duration timeout = context.config().testTimeout();
        if (remaining < timeout.toNanos()) {
            timeout = Duration.ofNanos(remaining);
        }
        CallOptions options = CallOptions.withTimeout(timeout);
        if (allocationOut != null) {
            options = options.withStatsSink((CallStats s) -> allocationOut[0] = s.serverAllocatedBytes());
        }

        long callStart = context.clock().nowNanos();
        try {
            context.client().call(method, request, options);
            return null;
        }
        catch (RpcException e) {
            long callNanos = context.clock().elapsedSince(callStart);
            TestResult.Builder b = CallOutcomes.apply(TestResult.builder(testName(method), category()), method, e);
            TestResult r = b.build();
            Duration duration = Duration.ofNanos(context.clock().elapsedSince(begin));
            if (r.status() == TestStatus.TIMED_OUT) {
                return Measurement.stalled(r.detail(), callNanos, duration);
            }
            return Measurement.outcome(r.status(), r.detail(), duration);
        }
    }

    private TestResult verdict(CategoryContext context, String name, CostSourceMethod method, ConformanceLevel level,
                               Measurement m, Duration latencyCeiling, long allocationCeiling)
    {
        TestResult.Builder result = TestResult.builder(name, category())
                .method(method)
                .level(level)
                .duration(m.duration());

        double tolerance = context.config().latencyTolerance();
        double ceilingMs = latencyCeiling.toNanos() / 1_000_000.0;
        double limitMs = ceilingMs * (1 + tolerance);

        if (m.stalledNanos() >= 0) {
            double stalledMs = m.stalledNanos() / 1_000_000.0;
            result.metric("latency_timeout_ms", stalledMs)
                    .metric("latency_ceiling_ms", ceilingMs);
            if (stalledMs >= limitMs) {
                return result.failed(format("call exceeded %.0f ms without replying, limit %.1f ms",
                        stalledMs, limitMs)).build();
            }
        }
        if (m.stats() == null) {
            return result.status(m.status()).detail(m.detail()).build();
        }

        LatencyStats stats = m.stats();

        result.metric("iterations", stats.count())
                .metric("latency_min_ms", stats.minMillis())
                .metric("latency_mean_ms", stats.meanMillis())
                .metric("latency_max_ms", stats.maxMillis())
                .metric("latency_ceiling_ms", ceilingMs)
                .metric("allocation_ceiling_bytes", allocationCeiling);

        List<String> failures = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (stats.meanMillis() > limitMs) {
            failures.add(format("mean latency %.1f ms exceeds ceiling %.0f ms (limit %.1f ms with %.0f%% tolerance);"
                            + " min %.1f ms, max %.1f ms over %d calls",
                    stats.meanMillis(), ceilingMs, limitMs, tolerance * 100,
                    stats.minMillis(), stats.maxMillis(), stats.count()));
        }
        else if (stats.meanMillis() > ceilingMs * (1 - tolerance)) {
            warnings.add(format("mean latency %.1f ms is within %.0f%% of ceiling %.0f ms",
                    stats.meanMillis(), tolerance * 100, ceilingMs));
        }

        if (m.allocationMeanBytes() >= 0) {
            double mean = m.allocationMeanBytes();
            result.metric("allocation_mean_bytes", mean);
            if (mean > allocationCeiling * (1 + tolerance)) {
                failures.add(format("mean allocation %.0f bytes per call exceeds ceiling %d bytes",
                        mean, allocationCeiling));
            }
            else if (mean > allocationCeiling * (1 - tolerance)) {
                warnings.add(format("mean allocation %.0f bytes per call is within %.0f%% of ceiling %d bytes",
                        mean, tolerance * 100, allocationCeiling));
            }
        }
        else {
            warnings.add("allocation measurement unavailable; latency only");
        }

        for (String w : warnings) {
            context.warn(category(), name, w);
        }
        result.warnings(warnings);

        if (failures.isEmpty()) {
            return result.passed().build();
        }
        return result.failed(String.join("; ", failures)).build();
    }

    private static TestResult withLevel(TestResult r)
    {
        return new TestResult(r.name(), r.category(), r.method(), ConformanceLevel.ADVANCED, r.status(),
                r.duration(), r.detail(), r.metrics(), r.warnings());
    }

    private static String format(String pattern, Object... args)
    {
        return String.format(Locale.ROOT, pattern, args);
    }

    /**
     * Samples for one method, or the outcome that stopped the measurement.
     * {@code stalledNanos} is how long a call ran before its deadline, or -1.
     */
    private record Measurement(
            LatencyStats stats,
            double allocationMeanBytes,
            TestStatus status,
            String detail,
            long stalledNanos,
            Duration duration
    ) {
        static Measurement of(LatencyStats stats, long[] allocations, Duration duration)
        {
            double sum = 0;
            for (long a : allocations) {
                if (a < 0) {
                    return new Measurement(stats, -1, TestStatus.PASSED, "", -1, duration);
                }
                sum += a;
            }
            return new Measurement(stats, sum / allocations.length, TestStatus.PASSED, "", -1, duration);
        }

        static Measurement outcome(TestStatus status, String detail, Duration duration)
        {
            return new Measurement(null, -1, status, detail, -1, duration);
        }

        static Measurement stalled(String detail, long callNanos, Duration duration)
        {
            return new Measurement(null, -1, TestStatus.TIMED_OUT, detail, callNanos, duration);
        }
    }
}
