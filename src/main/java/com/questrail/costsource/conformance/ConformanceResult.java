package com.questrail.costsource.conformance;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ConformanceResult
 * =============================================================================
 * Terminal artifact of a conformance run.
 *
 * <p>{@code achievedLevel} is {@code null} when the plugin did not reach even
 * {@link ConformanceLevel#BASIC}; use {@link #achieved()} for the optional
 * view. Categories are listed in execution order, one entry per
 * {@link TestCategory}, attempted or not.</p>
 */
public record ConformanceResult(
        String reportVersion,
        String pluginName,
        ConformanceLevel requestedLevel,
        ConformanceLevel achievedLevel,
        List<CategoryResult> categories,
        Duration duration,
        String summary
) {
    public static final String REPORT_VERSION = "1.0.0";

    public ConformanceResult {
        Objects.requireNonNull(reportVersion, "reportVersion");
        Objects.requireNonNull(requestedLevel, "requestedLevel");
        Objects.requireNonNull(duration, "duration");
        pluginName = (pluginName == null) ? "" : pluginName;
        categories = (categories == null) ? List.of() : List.copyOf(categories);
        summary = (summary == null) ? "" : summary;
    }

    public Optional<ConformanceLevel> achieved()
    {
        return Optional.ofNullable(achievedLevel);
    }

    public boolean certifiedAt(ConformanceLevel level)
    {
        return achievedLevel != null && achievedLevel.includes(level);
    }

    public Optional<CategoryResult> category(TestCategory category)
    {
        return categories.stream().filter(c -> c.category() == category).findFirst();
    }

    public int totalTests()
    {
        return categories.stream().mapToInt(CategoryResult::total).sum();
    }

    public int totalPassed()
    {
        return categories.stream().mapToInt(CategoryResult::passed).sum();
    }

    public int totalFailed()
    {
        return categories.stream().mapToInt(CategoryResult::failed).sum();
    }

    public int totalSkipped()
    {
        return categories.stream().mapToInt(CategoryResult::skipped).sum();
    }

    public int totalInconclusive()
    {
        return categories.stream().mapToInt(CategoryResult::inconclusive).sum();
    }

    public List<TestResult> allResults()
    {
        return categories.stream().flatMap(c -> c.results().stream()).toList();
    }
}
