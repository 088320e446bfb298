package com.questrail.costsource.conformance;

/**
 * Graded certification levels, ordered {@code BASIC < STANDARD < ADVANCED}.
 *
 * <p>A higher level includes every lower one: a plugin certified at
 * {@code ADVANCED} also satisfies {@code STANDARD} and {@code BASIC}.</p>
 */
public enum ConformanceLevel
{
    BASIC("Basic"),
    STANDARD("Standard"),
    ADVANCED("Advanced");

    private final String displayName;

    ConformanceLevel(String displayName)
    {
        this.displayName = displayName;
    }

    public String displayName()
    {
        return displayName;
    }

    /**
     * True when this level is {@code other} or above it.
     */
    public boolean includes(ConformanceLevel other)
    {
        return compareTo(other) >= 0;
    }
}
