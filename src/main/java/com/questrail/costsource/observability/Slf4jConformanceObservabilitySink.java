package com.questrail.costsource.observability;

import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConformanceObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConformanceObservabilitySink implements ConformanceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConformanceObservabilitySink.class);

    @Override
    public void onSuiteStarted(String pluginName, ConformanceLevel requested) {
        log.info("Conformance run started: plugin={} requested={}", pluginName, requested.displayName());
    }

    @Override
    public void onCategoryStarted(TestCategory category) {
        log.info("Category {} started", category.id());
    }

    @Override
    public void onTestCompleted(TestResult result) {
        switch (result.status()) {
            case PASSED, SKIPPED -> log.debug("{} {} ({} ms) {}",
                result.name(), result.status(), result.duration().toMillis(), result.detail());
            default -> log.warn("{} {} ({} ms): {}",
                result.name(), result.status(), result.duration().toMillis(), result.detail());
        }
    }

    @Override
    public void onCategoryCompleted(CategoryResult result) {
        log.info("Category {} completed: passed={} failed={} skipped={} inconclusive={}",
            result.category().id(),
            result.passed(),
            result.failed(),
            result.skipped(),
            result.inconclusive());
    }

    @Override
    public void onSuiteCompleted(ConformanceResult result) {
        log.info("Conformance run completed: {}", result.summary());
    }

    @Override
    public void onWarning(ConformanceWarningEvent event) {
        log.warn("[{}] {}: {}", event.category().id(), event.testName(), event.message());
    }

    @Override
    public void onError(ConformanceErrorEvent event) {
        log.error("Conformance harness error: {}", event.message(), event.cause());
    }
}
