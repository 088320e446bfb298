package com.questrail.costsource.conformance;

/**
 * Outcome of one conformance test.
 *
 * <p>{@link #TIMED_OUT} and {@link #CANCELLED} are inconclusive: they say the
 * environment or the caller ended the test, not that the plugin is wrong.
 * Only {@link #FAILED} blocks certification outright, but inconclusive
 * results prove nothing either: a level also needs passing tests, see
 * {@link CategoryResult#satisfiedAt}.</p>
 */
public enum TestStatus
{
    PASSED,
    FAILED,
    SKIPPED,
    TIMED_OUT,
    CANCELLED;

    public boolean blocksCertification()
    {
        return this == FAILED;
    }

    public boolean isInconclusive()
    {
        return this == TIMED_OUT || this == CANCELLED;
    }
}
