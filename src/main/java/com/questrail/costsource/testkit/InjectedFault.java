package com.questrail.costsource.testkit;

/**
 * Thrown by a {@link MethodBehavior.Panic} behavior. Deliberately not an
 * {@link com.questrail.costsource.api.RpcException}: it models an
 * implementation crashing rather than returning a status.
 */
public class InjectedFault extends RuntimeException
{
    public InjectedFault(String message)
    {
        super(message);
    }
}
