package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;

/**
 * Maps a non-OK call status onto a test outcome when the check expected a
 * successful call.
 *
 * <ul>
 *   <li>{@code DEADLINE_EXCEEDED}: timed out</li>
 *   <li>{@code CANCELLED}: cancelled</li>
 *   <li>{@code UNIMPLEMENTED} from an optional method: skipped</li>
 *   <li>a recovered implementation fault: failed with the fault message as detail</li>
 *   <li>anything else: failed with the status and message</li>
 * </ul>
 */
public final class CallOutcomes
{
    private CallOutcomes()
    {
    }

    public static TestResult.Builder apply(TestResult.Builder result, CostSourceMethod method, RpcException e)
    {
        return switch (e.code()) {
            case DEADLINE_EXCEEDED -> result.status(TestStatus.TIMED_OUT).detail(describe(e));
            case CANCELLED -> result.status(TestStatus.CANCELLED).detail(describe(e));
            case UNIMPLEMENTED -> (method != null && method.isOptional())
                    ? result.skipped(method.wireName() + " is not implemented")
                    : result.failed("required method returned " + describe(e));
            default -> result.failed(e.isImplementationFault() ? e.getMessage() : "unexpected " + describe(e));
        };
    }

    public static String describe(RpcException e)
    {
        return describe(e.code(), e.getMessage());
    }

    public static String describe(StatusCode code, String message)
    {
        return (message == null || message.isEmpty()) ? code.name() : code.name() + ": " + message;
    }
}
