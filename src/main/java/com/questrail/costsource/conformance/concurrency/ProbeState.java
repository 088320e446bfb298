package com.questrail.costsource.conformance.concurrency;

/**
 * Lifecycle of one {@link FanOutProbe}.
 *
 * <pre>
 *   IDLE -> DISPATCHING -> COLLECTING -> VERIFIED | FAILED
 * </pre>
 *
 * <p>{@code FAILED} covers every probe that could not be verified, including
 * ones whose calls timed out or were cancelled; the test outcome says
 * which.</p>
 */
public enum ProbeState
{
    IDLE,
    DISPATCHING,
    COLLECTING,
    VERIFIED,
    FAILED;

    public boolean isTerminal()
    {
        return this == VERIFIED || this == FAILED;
    }

    boolean canMoveTo(ProbeState next)
    {
        return switch (this) {
            case IDLE -> next == DISPATCHING;
            case DISPATCHING -> next == COLLECTING || next == FAILED;
            case COLLECTING -> next == VERIFIED || next == FAILED;
            case VERIFIED, FAILED -> false;
        };
    }
}
