package com.questrail.costsource.conformance;

/**
 * TestCategory
 * -----------------------------------------------------------------------------
 * The four categories of conformance checks, declared in their fixed execution
 * order. Structural checks run first so that a broken plugin fails fast before
 * the expensive performance and concurrency work.
 *
 * <p>Each category is required from its {@link #minimumLevel()} upwards.</p>
 */
public enum TestCategory
{
    SPEC_VALIDATION("spec_validation", "Specification Validation", ConformanceLevel.BASIC),
    RPC_CORRECTNESS("rpc_correctness", "RPC Correctness", ConformanceLevel.BASIC),
    PERFORMANCE("performance", "Performance", ConformanceLevel.STANDARD),
    CONCURRENCY("concurrency", "Concurrency", ConformanceLevel.STANDARD);

    private final String id;
    private final String displayName;
    private final ConformanceLevel minimumLevel;

    TestCategory(String id, String displayName, ConformanceLevel minimumLevel)
    {
        this.id = id;
        this.displayName = displayName;
        this.minimumLevel = minimumLevel;
    }

    /** Stable identifier used in structured reports. */
    public String id()
    {
        return id;
    }

    public String displayName()
    {
        return displayName;
    }

    public ConformanceLevel minimumLevel()
    {
        return minimumLevel;
    }

    public boolean requiredAt(ConformanceLevel level)
    {
        return level.includes(minimumLevel);
    }
}
