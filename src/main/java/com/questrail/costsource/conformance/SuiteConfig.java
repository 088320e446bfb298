package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.CostSourceService;
import com.questrail.costsource.conformance.perf.PerformanceBaseline;
import com.questrail.costsource.conformance.perf.PerformanceBaselines;
import com.questrail.costsource.observability.ConformanceObservabilitySink;
import com.questrail.costsource.observability.NullObservabilitySink;
import com.questrail.costsource.rpc.RpcFrameCodec;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * SuiteConfig
 * =============================================================================
 * Immutable configuration for one conformance run.
 *
 * <p>The {@code target} is borrowed: the suite calls it but never stops,
 * closes or retains it beyond the run. The caller owns its lifetime.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>level</b>: requested certification level (default Standard)</li>
 *   <li><b>testTimeout</b>: per-call timeout (default 60s)</li>
 *   <li><b>concurrencyFanOut</b>: simultaneous calls per concurrency probe
 *       (default 10)</li>
 *   <li><b>advancedFanOut</b>: fan-out of the Advanced-only high-load probe
 *       (default 50)</li>
 *   <li><b>warmupIterations</b> / <b>measuredIterations</b>: discarded and timed
 *       calls per method in the performance category (defaults 3 / 10)</li>
 *   <li><b>latencyTolerance</b>: fraction above a ceiling still accepted,
 *       so a method fails only past {@code ceiling x (1 + tolerance)}
 *       (default 0.10)</li>
 *   <li><b>performanceBudget</b>: wall-clock budget for the whole performance
 *       category (default 5 minutes)</li>
 *   <li><b>baselineOverrides</b>: per-method replacements for the default
 *       {@link PerformanceBaselines} table</li>
 *   <li><b>raceDetectionActive</b>: the JVM runs under a race-detecting agent;
 *       without it concurrency results carry a warning (default false)</li>
 *   <li><b>maxMessageBytes</b>: harness message size limit (default 4 MiB)</li>
 *   <li><b>observabilitySink</b>: run event sink (default no-op)</li>
 * </ul>
 */
public record SuiteConfig(
        CostSourceService target,
        ConformanceLevel level,
        Duration testTimeout,
        int concurrencyFanOut,
        int advancedFanOut,
        int warmupIterations,
        int measuredIterations,
        double latencyTolerance,
        Duration performanceBudget,
        Map<CostSourceMethod, PerformanceBaseline> baselineOverrides,
        boolean raceDetectionActive,
        int maxMessageBytes,
        ConformanceObservabilitySink observabilitySink
) {
    public static final Duration DEFAULT_TEST_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration ADVANCED_TEST_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_FAN_OUT = 10;
    public static final int ADVANCED_FAN_OUT = 50;
    public static final int DEFAULT_WARMUP_ITERATIONS = 3;
    public static final int DEFAULT_MEASURED_ITERATIONS = 10;
    public static final double DEFAULT_LATENCY_TOLERANCE = 0.10;
    public static final Duration DEFAULT_PERFORMANCE_BUDGET = Duration.ofMinutes(5);

    /**
     * Canonical constructor with validation.
     */
    public SuiteConfig {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(testTimeout, "testTimeout");
        Objects.requireNonNull(performanceBudget, "performanceBudget");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        if (testTimeout.isNegative() || testTimeout.isZero()) {
            throw new IllegalArgumentException("testTimeout must be positive");
        }
        if (concurrencyFanOut < 1) {
            throw new IllegalArgumentException("concurrencyFanOut must be at least 1");
        }
        if (advancedFanOut < 1) {
            throw new IllegalArgumentException("advancedFanOut must be at least 1");
        }
        if (warmupIterations < 0) {
            throw new IllegalArgumentException("warmupIterations must be non-negative");
        }
        if (measuredIterations < 1) {
            throw new IllegalArgumentException("measuredIterations must be at least 1");
        }
        if (!(latencyTolerance >= 0.0 && latencyTolerance < 1.0)) {
            throw new IllegalArgumentException("latencyTolerance must be in [0, 1)");
        }
        if (performanceBudget.isNegative() || performanceBudget.isZero()) {
            throw new IllegalArgumentException("performanceBudget must be positive");
        }
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be positive");
        }

        baselineOverrides = (baselineOverrides == null) ? Map.of() : Map.copyOf(baselineOverrides);
        for (Map.Entry<CostSourceMethod, PerformanceBaseline> e : baselineOverrides.entrySet()) {
            if (e.getValue().method() != e.getKey()) {
                throw new IllegalArgumentException("baseline for " + e.getValue().method() + " keyed under " + e.getKey());
            }
        }
    }

    /**
     * Effective baseline table: defaults with overrides applied.
     */
    public Map<CostSourceMethod, PerformanceBaseline> baselines()
    {
        return PerformanceBaselines.resolve(baselineOverrides);
    }

    public SuiteConfig withLevel(ConformanceLevel newLevel)
    {
        return new SuiteConfig(target, newLevel, testTimeout, concurrencyFanOut, advancedFanOut, warmupIterations,
                measuredIterations, latencyTolerance, performanceBudget, baselineOverrides, raceDetectionActive,
                maxMessageBytes, observabilitySink);
    }

    public static Builder builder(CostSourceService target)
    {
        return new Builder(target);
    }

    public static final class Builder {
        private final CostSourceService target;
        private ConformanceLevel level = ConformanceLevel.STANDARD;
        private Duration testTimeout = DEFAULT_TEST_TIMEOUT;
        private int concurrencyFanOut = DEFAULT_FAN_OUT;
        private int advancedFanOut = ADVANCED_FAN_OUT;
        private int warmupIterations = DEFAULT_WARMUP_ITERATIONS;
        private int measuredIterations = DEFAULT_MEASURED_ITERATIONS;
        private double latencyTolerance = DEFAULT_LATENCY_TOLERANCE;
        private Duration performanceBudget = DEFAULT_PERFORMANCE_BUDGET;
        private final Map<CostSourceMethod, PerformanceBaseline> baselineOverrides =
                new EnumMap<>(CostSourceMethod.class);
        private boolean raceDetectionActive = false;
        private int maxMessageBytes = RpcFrameCodec.DEFAULT_MAX_MESSAGE_BYTES;
        private ConformanceObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder(CostSourceService target) {
            this.target = Objects.requireNonNull(target, "target");
        }

        public Builder withLevel(ConformanceLevel level) {
            this.level = level;
            return this;
        }

        public Builder withTestTimeout(Duration timeout) {
            this.testTimeout = timeout;
            return this;
        }

        public Builder withConcurrencyFanOut(int fanOut) {
            this.concurrencyFanOut = fanOut;
            return this;
        }

        public Builder withAdvancedFanOut(int fanOut) {
            this.advancedFanOut = fanOut;
            return this;
        }

        public Builder withWarmupIterations(int iterations) {
            this.warmupIterations = iterations;
            return this;
        }

        public Builder withMeasuredIterations(int iterations) {
            this.measuredIterations = iterations;
            return this;
        }

        public Builder withLatencyTolerance(double tolerance) {
            this.latencyTolerance = tolerance;
            return this;
        }

        public Builder withPerformanceBudget(Duration budget) {
            this.performanceBudget = budget;
            return this;
        }

        public Builder withBaseline(PerformanceBaseline baseline) {
            this.baselineOverrides.put(baseline.method(), baseline);
            return this;
        }

        public Builder withRaceDetectionActive(boolean active) {
            this.raceDetectionActive = active;
            return this;
        }

        public Builder withMaxMessageBytes(int bytes) {
            this.maxMessageBytes = bytes;
            return this;
        }

        public Builder withObservabilitySink(ConformanceObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SuiteConfig build() {
            return new SuiteConfig(target, level, testTimeout, concurrencyFanOut, advancedFanOut, warmupIterations,
                    measuredIterations, latencyTolerance, performanceBudget, baselineOverrides, raceDetectionActive,
                    maxMessageBytes, observabilitySink);
        }
    }
}
