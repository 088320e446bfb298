package com.questrail.costsource.harness;

/**
 * HarnessException
 * -----------------------------------------------------------------------------
 * Infrastructure failure of the harness itself: the in-memory channel could
 * not be established, an implementation is already bound, or the harness was
 * misused.
 *
 * <p>This is the only exception a conformance run propagates. It means no
 * certification claim can be made, as opposed to a plugin failing its checks.</p>
 */
public class HarnessException extends RuntimeException
{
    public HarnessException(String message)
    {
        super(message);
    }

    public HarnessException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
