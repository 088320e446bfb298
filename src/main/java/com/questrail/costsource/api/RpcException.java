package com.questrail.costsource.api;

import java.util.Objects;

/**
 * RpcException
 * -----------------------------------------------------------------------------
 * Unchecked exception carrying a non-OK {@link StatusCode}.
 *
 * <p>Implementations of {@link CostSourceService} throw it to return a status to
 * the caller; the harness client throws it when a call completes with a non-OK
 * status. {@link #isImplementationFault()} is set only when the server fault
 * boundary converted an abnormal termination of the implementation into an
 * {@link StatusCode#INTERNAL} status.</p>
 */
public class RpcException extends RuntimeException
{
    private final StatusCode code;
    private final boolean implementationFault;

    public RpcException(StatusCode code, String message)
    {
        this(code, message, false, null);
    }

    public RpcException(StatusCode code, String message, Throwable cause)
    {
        this(code, message, false, cause);
    }

    public RpcException(StatusCode code, String message, boolean implementationFault, Throwable cause)
    {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        if (code == StatusCode.OK) {
            throw new IllegalArgumentException("RpcException requires a non-OK status");
        }
        this.implementationFault = implementationFault;
    }

    public StatusCode code()
    {
        return code;
    }

    public boolean isImplementationFault()
    {
        return implementationFault;
    }

    public static RpcException invalidArgument(String message)
    {
        return new RpcException(StatusCode.INVALID_ARGUMENT, message);
    }

    public static RpcException notFound(String message)
    {
        return new RpcException(StatusCode.NOT_FOUND, message);
    }

    public static RpcException unimplemented(String method)
    {
        return new RpcException(StatusCode.UNIMPLEMENTED, method + " is not implemented");
    }

    public static RpcException internal(String message)
    {
        return new RpcException(StatusCode.INTERNAL, message);
    }

    @Override
    public String toString()
    {
        return "RpcException[" + code + (implementationFault ? ", fault" : "") + "]: " + getMessage();
    }
}
