package com.questrail.costsource.api;

/**
 * StatusCode
 * =============================================================================
 * RPC status codes carried across the harness boundary.
 *
 * <p>The set and numbering follow the canonical RPC status code table so that
 * reports and logs line up with what a networked client would observe.</p>
 */
public enum StatusCode
{
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int value;

    StatusCode(int value)
    {
        this.value = value;
    }

    public int value()
    {
        return value;
    }

    /**
     * A defined rejection is any non-OK status that names a reason, as opposed
     * to the generic {@link #INTERNAL} and {@link #UNKNOWN} failures.
     */
    public boolean isDefinedRejection()
    {
        return this != OK && this != INTERNAL && this != UNKNOWN;
    }

    /**
     * Timeouts and caller cancellations say nothing about plugin correctness.
     */
    public boolean isInconclusive()
    {
        return this == DEADLINE_EXCEEDED || this == CANCELLED;
    }
}
