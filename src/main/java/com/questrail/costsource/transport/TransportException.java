package com.questrail.costsource.transport;

/**
 * Raised when a {@link FrameEndpoint} cannot start or cannot deliver a frame.
 */
public class TransportException extends RuntimeException
{
    public TransportException(String message)
    {
        super(message);
    }

    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
