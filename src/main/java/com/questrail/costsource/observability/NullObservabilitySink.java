package com.questrail.costsource.observability;

import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;

/**
 * No-op implementation of ConformanceObservabilitySink.
 */
public final class NullObservabilitySink implements ConformanceObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSuiteStarted(String pluginName, ConformanceLevel requested) {}

    @Override
    public void onCategoryStarted(TestCategory category) {}

    @Override
    public void onTestCompleted(TestResult result) {}

    @Override
    public void onCategoryCompleted(CategoryResult result) {}

    @Override
    public void onSuiteCompleted(ConformanceResult result) {}

    @Override
    public void onWarning(ConformanceWarningEvent event) {}

    @Override
    public void onError(ConformanceErrorEvent event) {}
}
