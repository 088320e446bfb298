package com.questrail.costsource.conformance;

import java.util.List;

/**
 * A self-contained set of checks for one {@link TestCategory}.
 *
 * <p>Implementations report every contract problem as a {@link TestResult}
 * and return normally. Only a failure of the harness itself may escape.</p>
 */
public interface ConformanceCategory
{
    TestCategory category();

    List<TestResult> run(CategoryContext context);
}
