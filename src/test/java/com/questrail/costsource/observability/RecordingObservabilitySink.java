package com.questrail.costsource.observability;

import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ConformanceObservabilitySink {
    public record SuiteStarted(String pluginName, ConformanceLevel requested) {}

    public record CategoryStarted(TestCategory category) {}

    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onSuiteStarted(String pluginName, ConformanceLevel requested) {
        events.add(new SuiteStarted(pluginName, requested));
    }

    @Override
    public synchronized void onCategoryStarted(TestCategory category) {
        events.add(new CategoryStarted(category));
    }

    @Override
    public synchronized void onTestCompleted(TestResult result) {
        events.add(result);
    }

    @Override
    public synchronized void onCategoryCompleted(CategoryResult result) {
        events.add(result);
    }

    @Override
    public synchronized void onSuiteCompleted(ConformanceResult result) {
        events.add(result);
    }

    @Override
    public synchronized void onWarning(ConformanceWarningEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ConformanceErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
