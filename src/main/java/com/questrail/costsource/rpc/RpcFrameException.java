package com.questrail.costsource.rpc;

/**
 * Raised when bytes received from the transport are not a valid {@link RpcFrame}.
 */
public class RpcFrameException extends RuntimeException
{
    public RpcFrameException(String message)
    {
        super(message);
    }

    public RpcFrameException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
