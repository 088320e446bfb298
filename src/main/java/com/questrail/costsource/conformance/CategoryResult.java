package com.questrail.costsource.conformance;

import java.util.List;
import java.util.Objects;

/**
 * CategoryResult
 * -----------------------------------------------------------------------------
 * Counts and outcomes for one {@link TestCategory}.
 *
 * <p>A category with no results is <em>unattempted</em>: it was not run, or its
 * module registered no tests. An unattempted category is never satisfied.</p>
 *
 * <p>Neither is a category with nothing but skipped and inconclusive results.
 * A plugin that never answers in time has not shown anything.</p>
 */
public record CategoryResult(
        TestCategory category,
        boolean attempted,
        int passed,
        int failed,
        int skipped,
        int timedOut,
        int cancelled,
        List<TestResult> results
) {
    public CategoryResult {
        Objects.requireNonNull(category, "category");
        results = (results == null) ? List.of() : List.copyOf(results);
    }

    public static CategoryResult unattempted(TestCategory category)
    {
        return new CategoryResult(category, false, 0, 0, 0, 0, 0, List.of());
    }

    public int total()
    {
        return results.size();
    }

    public int inconclusive()
    {
        return timedOut + cancelled;
    }

    /**
     * Attempted, with no failures and at least one passing test.
     */
    public boolean satisfied()
    {
        return attempted && failed == 0 && passed > 0;
    }

    /**
     * Whether the category supports certification at {@code level}.
     * <ul>
     *   <li>no test gating {@code level} or a lower level failed</li>
     *   <li>at least one of those tests passed</li>
     *   <li>if some tests gate exactly {@code level}, one of them passed</li>
     * </ul>
     * Failures of stricter, higher-level checks are ignored.
     */
    public boolean satisfiedAt(ConformanceLevel level)
    {
        if (!attempted) {
            return false;
        }
        List<TestResult> gating = results.stream()
                .filter(r -> level.includes(r.level()))
                .toList();
        if (gating.stream().anyMatch(r -> r.status().blocksCertification())) {
            return false;
        }
        if (gating.stream().noneMatch(r -> r.status() == TestStatus.PASSED)) {
            return false;
        }
        List<TestResult> atLevel = gating.stream()
                .filter(r -> r.level() == level)
                .toList();
        return atLevel.isEmpty() || atLevel.stream().anyMatch(r -> r.status() == TestStatus.PASSED);
    }
}
