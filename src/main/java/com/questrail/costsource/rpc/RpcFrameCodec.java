package com.questrail.costsource.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * RpcFrameCodec
 * =============================================================================
 * Encodes {@link RpcFrame}s and the messages they carry.
 *
 * <h2>Frame layout</h2>
 * <pre>
 *   +-------------------+----------------------+-------------------+
 *   | header length (4) | header (JSON)        | payload (JSON)    |
 *   +-------------------+----------------------+-------------------+
 * </pre>
 *
 * <h2>Message size limit</h2>
 * {@link #encodeMessage(Object)} refuses any message whose encoding exceeds
 * {@code maxMessageBytes}, with {@link StatusCode#RESOURCE_EXHAUSTED}, the way
 * an RPC runtime enforces its send limit.
 *
 * <p>Instances are immutable and safe for concurrent use.</p>
 */
public final class RpcFrameCodec
{
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 4 * 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxMessageBytes;

    public RpcFrameCodec(int maxMessageBytes)
    {
        this(RpcJson.newMapper(), maxMessageBytes);
    }

    public RpcFrameCodec(ObjectMapper mapper, int maxMessageBytes)
    {
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be positive");
        }
        this.mapper = mapper;
        this.maxMessageBytes = maxMessageBytes;
    }

    public int maxMessageBytes()
    {
        return maxMessageBytes;
    }

    public byte[] encodeMessage(Object message)
    {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(message);
        }
        catch (JsonProcessingException e) {
            throw new RpcException(StatusCode.INTERNAL, "failed to encode message: " + e.getOriginalMessage(), e);
        }
        if (bytes.length > maxMessageBytes) {
            throw new RpcException(StatusCode.RESOURCE_EXHAUSTED,
                    "message larger than max (" + bytes.length + " vs. " + maxMessageBytes + ")");
        }
        return bytes;
    }

    public <T> T decodeMessage(byte[] bytes, Class<T> type)
    {
        if (bytes.length > maxMessageBytes) {
            throw new RpcException(StatusCode.RESOURCE_EXHAUSTED,
                    "message larger than max (" + bytes.length + " vs. " + maxMessageBytes + ")");
        }
        try {
            return mapper.readValue(bytes, type);
        }
        catch (IOException e) {
            throw new RpcException(StatusCode.INTERNAL,
                    "failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public byte[] encodeFrame(RpcFrame frame)
    {
        byte[] header;
        try {
            header = mapper.writeValueAsBytes(Header.of(frame));
        }
        catch (JsonProcessingException e) {
            throw new RpcFrameException("failed to encode frame header", e);
        }

        byte[] payload = frame.payload();
        ByteBuffer out = ByteBuffer.allocate(4 + header.length + payload.length);
        out.putInt(header.length);
        out.put(header);
        out.put(payload);
        return out.array();
    }

    public RpcFrame decodeFrame(byte[] bytes)
    {
        if (bytes.length < 4) {
            throw new RpcFrameException("frame too short: " + bytes.length + " bytes");
        }
        ByteBuffer in = ByteBuffer.wrap(bytes);
        int headerLength = in.getInt();
        if (headerLength < 0 || headerLength > bytes.length - 4) {
            throw new RpcFrameException("invalid header length " + headerLength);
        }

        Header header;
        try {
            header = mapper.readValue(bytes, 4, headerLength, Header.class);
        }
        catch (IOException e) {
            throw new RpcFrameException("malformed frame header", e);
        }

        byte[] payload = new byte[bytes.length - 4 - headerLength];
        System.arraycopy(bytes, 4 + headerLength, payload, 0, payload.length);
        return header.toFrame(payload);
    }

    /**
     * JSON header: every frame field except the payload.
     */
    record Header(
            RpcFrame.Type type,
            long callId,
            String method,
            long timeoutMillis,
            StatusCode status,
            String message,
            boolean implementationFault,
            long serverNanos,
            long serverAllocatedBytes
    ) {
        static Header of(RpcFrame f)
        {
            return new Header(f.type(), f.callId(), f.method(), f.timeoutMillis(), f.status(), f.message(),
                    f.implementationFault(), f.serverNanos(), f.serverAllocatedBytes());
        }

        RpcFrame toFrame(byte[] payload)
        {
            return new RpcFrame(type, callId, method, timeoutMillis, status, message,
                    implementationFault, serverNanos, serverAllocatedBytes, payload);
        }
    }
}
