package com.questrail.costsource.rpc;

import com.questrail.costsource.api.StatusCode;

import java.util.Objects;

/**
 * RpcFrame
 * -----------------------------------------------------------------------------
 * The envelope exchanged between harness client and server.
 *
 * <p>A {@link Type#REQUEST} carries the method wire name, the propagated
 * timeout and the encoded request message. A {@link Type#RESPONSE} carries the
 * status, the encoded response message (OK only) and the server-side call
 * statistics. A {@link Type#CANCEL} tells the server the caller gave up.</p>
 *
 * <p>{@code payload} is the encoded message body; it is kept outside the JSON
 * header so that size limits apply to the message itself.</p>
 *
 * <p>The status {@code message} travels in the header, so it is capped at
 * {@link #MAX_STATUS_MESSAGE_CHARS} characters. Longer messages are cut and
 * end with a {@code [truncated N chars]} marker. Even with every character
 * escaped, a capped header fits in the framing overhead the transport
 * allows on top of the largest message.</p>
 */
public record RpcFrame(
        Type type,
        long callId,
        String method,
        long timeoutMillis,
        StatusCode status,
        String message,
        boolean implementationFault,
        long serverNanos,
        long serverAllocatedBytes,
        byte[] payload
) {
    public enum Type
    {
        REQUEST,
        RESPONSE,
        CANCEL
    }

    public static final int MAX_STATUS_MESSAGE_CHARS = 4096;

    private static final byte[] EMPTY = new byte[0];

    public RpcFrame {
        Objects.requireNonNull(type, "type");
        status = (status == null) ? StatusCode.OK : status;
        message = capMessage(message);
        payload = (payload == null) ? EMPTY : payload;
    }

    static String capMessage(String message)
    {
        if (message == null) {
            return "";
        }
        if (message.length() <= MAX_STATUS_MESSAGE_CHARS) {
            return message;
        }
        int keep = MAX_STATUS_MESSAGE_CHARS;
        if (Character.isHighSurrogate(message.charAt(keep - 1))) {
            keep--;
        }
        return message.substring(0, keep) + "... [truncated " + (message.length() - keep) + " chars]";
    }

    public static RpcFrame request(long callId, String method, long timeoutMillis, byte[] payload)
    {
        return new RpcFrame(Type.REQUEST, callId, method, timeoutMillis, StatusCode.OK, "", false, 0, -1, payload);
    }

    public static RpcFrame ok(long callId, long serverNanos, long serverAllocatedBytes, byte[] payload)
    {
        return new RpcFrame(Type.RESPONSE, callId, null, 0, StatusCode.OK, "", false,
                serverNanos, serverAllocatedBytes, payload);
    }

    public static RpcFrame error(long callId, StatusCode status, String message, boolean implementationFault,
                                 long serverNanos, long serverAllocatedBytes)
    {
        return new RpcFrame(Type.RESPONSE, callId, null, 0, status, message, implementationFault,
                serverNanos, serverAllocatedBytes, EMPTY);
    }

    public static RpcFrame cancel(long callId)
    {
        return new RpcFrame(Type.CANCEL, callId, null, 0, StatusCode.CANCELLED, "", false, 0, -1, EMPTY);
    }
}
