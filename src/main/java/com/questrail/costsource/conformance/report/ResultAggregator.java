package com.questrail.costsource.conformance.report;

import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * ResultAggregator
 * =============================================================================
 * Reduces raw {@link TestResult}s into {@link CategoryResult}s and the final
 * {@link ConformanceResult}.
 *
 * <h2>Purity</h2>
 * Aggregation depends only on its arguments. Results are sorted into
 * {@link TestResult#CANONICAL_ORDER} first, so the same set of results in any
 * order aggregates to an equal result.
 *
 * <h2>Level achievement</h2>
 * Levels are tried from Basic up to the requested one. A level {@code L} is
 * achieved when every category required at {@code L} was attempted, none of
 * its tests gated at {@code L} or below failed, and some of them passed (see
 * {@link CategoryResult#satisfiedAt}). The first level that is not achieved
 * ends the climb, so an achieved level always implies every lower one. A
 * skipped or inconclusive test does not fail a level, but it does not earn
 * one either.
 */
public final class ResultAggregator
{
    private ResultAggregator()
    {
    }

    public static ConformanceResult aggregate(String pluginName, ConformanceLevel requested,
                                              Collection<TestResult> results, Duration duration)
    {
        Objects.requireNonNull(requested, "requested");
        Objects.requireNonNull(results, "results");

        List<CategoryResult> categories = new ArrayList<>();
        for (TestCategory category : TestCategory.values()) {
            categories.add(categoryResult(category, results));
        }
        ConformanceLevel achieved = achievedLevel(categories, requested);
        return new ConformanceResult(ConformanceResult.REPORT_VERSION, pluginName, requested, achieved, categories,
                duration, summarize(pluginName, requested, achieved, categories));
    }

    /**
     * Results of {@code category} among {@code results}; unattempted when
     * there are none.
     */
    public static CategoryResult categoryResult(TestCategory category, Collection<TestResult> results)
    {
        List<TestResult> own = results.stream()
                .filter(r -> r.category() == category)
                .sorted(TestResult.CANONICAL_ORDER)
                .toList();
        if (own.isEmpty()) {
            return CategoryResult.unattempted(category);
        }

        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int timedOut = 0;
        int cancelled = 0;
        for (TestResult r : own) {
            switch (r.status()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case TIMED_OUT -> timedOut++;
                case CANCELLED -> cancelled++;
            }
        }
        return new CategoryResult(category, true, passed, failed, skipped, timedOut, cancelled, own);
    }

    /**
     * Highest level achieved, or {@code null} when not even Basic is.
     */
    public static ConformanceLevel achievedLevel(List<CategoryResult> categories, ConformanceLevel requested)
    {
        ConformanceLevel achieved = null;
        for (ConformanceLevel level : ConformanceLevel.values()) {
            if (!requested.includes(level) || !satisfies(categories, level)) {
                break;
            }
            achieved = level;
        }
        return achieved;
    }

    private static boolean satisfies(List<CategoryResult> categories, ConformanceLevel level)
    {
        for (TestCategory category : TestCategory.values()) {
            if (!category.requiredAt(level)) {
                continue;
            }
            CategoryResult result = categories.stream()
                    .filter(c -> c.category() == category)
                    .findFirst()
                    .orElse(CategoryResult.unattempted(category));
            if (!result.satisfiedAt(level)) {
                return false;
            }
        }
        return true;
    }

    static String summarize(String pluginName, ConformanceLevel requested, ConformanceLevel achieved,
                            List<CategoryResult> categories)
    {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int inconclusive = 0;
        List<String> unattempted = new ArrayList<>();
        for (CategoryResult c : categories) {
            total += c.total();
            passed += c.passed();
            failed += c.failed();
            skipped += c.skipped();
            inconclusive += c.inconclusive();
            if (!c.attempted()) {
                unattempted.add(c.category().id());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Plugin '").append(pluginName == null ? "" : pluginName).append("' ");
        sb.append(achieved == null ? "did not achieve Basic" : "achieved " + achieved.displayName());
        sb.append(" (requested ").append(requested.displayName()).append("): ");
        sb.append(total).append(" tests, ")
                .append(passed).append(" passed, ")
                .append(failed).append(" failed, ")
                .append(skipped).append(" skipped");
        if (inconclusive > 0) {
            sb.append(", ").append(inconclusive).append(" timed out or cancelled");
        }
        if (!unattempted.isEmpty()) {
            sb.append("; not attempted: ").append(String.join(", ", unattempted));
        }
        return sb.toString();
    }
}
