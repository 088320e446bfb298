package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceMethod;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * TestResult
 * =============================================================================
 * One conformance test outcome.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li><b>name</b>: stable test name, unique within a run</li>
 *   <li><b>method</b>: contract method under test, {@code null} for
 *       cross-method tests</li>
 *   <li><b>level</b>: lowest certification level this outcome gates; an
 *       Advanced-only check never blocks Standard</li>
 *   <li><b>detail</b>: error detail for failed or inconclusive tests, or a
 *       short note otherwise; empty when there is nothing to say</li>
 *   <li><b>metrics</b>: raw numbers (latencies in milliseconds, allocations in
 *       bytes) attached regardless of outcome</li>
 *   <li><b>warnings</b>: annotations that do not change the status</li>
 * </ul>
 */
public record TestResult(
        String name,
        TestCategory category,
        CostSourceMethod method,
        ConformanceLevel level,
        TestStatus status,
        Duration duration,
        String detail,
        Map<String, Double> metrics,
        List<String> warnings
) {
    /**
     * Canonical ordering used wherever results are listed: by category, then
     * name.
     */
    public static final Comparator<TestResult> CANONICAL_ORDER =
            Comparator.comparing(TestResult::category).thenComparing(TestResult::name);

    public TestResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(duration, "duration");
        detail = (detail == null) ? "" : detail;
        metrics = (metrics == null)
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(metrics));
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public boolean hasDetail()
    {
        return !detail.isEmpty();
    }

    public static Builder builder(String name, TestCategory category)
    {
        return new Builder(name, category);
    }

    public static final class Builder {
        private final String name;
        private final TestCategory category;
        private CostSourceMethod method;
        private ConformanceLevel level;
        private TestStatus status = TestStatus.PASSED;
        private Duration duration = Duration.ZERO;
        private String detail = "";
        private final Map<String, Double> metrics = new TreeMap<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder(String name, TestCategory category) {
            this.name = Objects.requireNonNull(name, "name");
            this.category = Objects.requireNonNull(category, "category");
            this.level = category.minimumLevel();
        }

        public Builder method(CostSourceMethod method) {
            this.method = method;
            return this;
        }

        public Builder level(ConformanceLevel level) {
            this.level = level;
            return this;
        }

        public Builder status(TestStatus status) {
            this.status = status;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder metric(String key, double value) {
            this.metrics.put(key, value);
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder passed() {
            return status(TestStatus.PASSED);
        }

        public Builder failed(String detail) {
            return status(TestStatus.FAILED).detail(detail);
        }

        public Builder skipped(String reason) {
            return status(TestStatus.SKIPPED).detail(reason);
        }

        public TestResult build() {
            return new TestResult(name, category, method, level, status, duration, detail, metrics, warnings);
        }
    }
}
