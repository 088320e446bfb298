package com.questrail.costsource.observability;

import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;

/**
 * Main interface for receiving conformance run events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ConformanceObservabilitySink {
    /**
     * Called once the plugin has been bound and identified.
     * @param pluginName name reported by the plugin
     * @param requested level the run was asked to certify
     */
    void onSuiteStarted(String pluginName, ConformanceLevel requested);

    /**
     * Called before a category module runs.
     */
    void onCategoryStarted(TestCategory category);

    /**
     * Called for every test outcome, in execution order.
     */
    void onTestCompleted(TestResult result);

    /**
     * Called after a category module returns.
     */
    void onCategoryCompleted(CategoryResult result);

    /**
     * Called with the final, aggregated result.
     */
    void onSuiteCompleted(ConformanceResult result);

    /**
     * Called when a check wants to flag something that does not change an outcome.
     */
    void onWarning(ConformanceWarningEvent event);

    /**
     * Called when the harness itself fails.
     */
    void onError(ConformanceErrorEvent event);
}
