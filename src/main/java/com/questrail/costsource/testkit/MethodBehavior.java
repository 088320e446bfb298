package com.questrail.costsource.testkit;

import com.questrail.costsource.api.CallContext;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;

import java.util.Objects;
import java.util.function.Function;

/**
 * MethodBehavior
 * -----------------------------------------------------------------------------
 * What a {@link ConfigurableCostSource} does when one of its methods is called.
 *
 * <p>A method with no behavior is <em>unconfigured</em>: it answers
 * {@link StatusCode#UNIMPLEMENTED} and, for optional methods, is not advertised
 * by {@code Supports}.</p>
 */
public sealed interface MethodBehavior
        permits MethodBehavior.Respond, MethodBehavior.Fail, MethodBehavior.Panic
{
    Object execute(CallContext ctx, Object request);

    static MethodBehavior respond(Object response)
    {
        Objects.requireNonNull(response, "response");
        return new Respond(request -> response);
    }

    static MethodBehavior respondWith(Function<Object, Object> responder)
    {
        return new Respond(responder);
    }

    static MethodBehavior fail(StatusCode code, String message)
    {
        return new Fail(code, message);
    }

    static MethodBehavior panic(String message)
    {
        return new Panic(message);
    }

    /**
     * Returns the response computed from the request.
     */
    record Respond(Function<Object, Object> responder) implements MethodBehavior
    {
        public Respond {
            Objects.requireNonNull(responder, "responder");
        }

        @Override
        public Object execute(CallContext ctx, Object request)
        {
            return responder.apply(request);
        }
    }

    /**
     * Returns a non-OK status.
     */
    record Fail(StatusCode code, String message) implements MethodBehavior
    {
        public Fail {
            Objects.requireNonNull(code, "code");
            if (code == StatusCode.OK) {
                throw new IllegalArgumentException("a failure needs a non-OK status");
            }
            message = (message == null) ? "" : message;
        }

        @Override
        public Object execute(CallContext ctx, Object request)
        {
            throw new RpcException(code, message);
        }
    }

    /**
     * Terminates abnormally, the way a crashing plugin would.
     */
    record Panic(String message) implements MethodBehavior
    {
        public Panic {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Object execute(CallContext ctx, Object request)
        {
            throw new InjectedFault(message);
        }
    }
}
