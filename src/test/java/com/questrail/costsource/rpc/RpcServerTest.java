package com.questrail.costsource.rpc;

import com.questrail.costsource.api.CallContext;
import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.testkit.ConfigurableCostSource;
import com.questrail.costsource.testkit.MethodBehavior;
import com.questrail.costsource.time.ManualMonotonicClock;
import com.questrail.costsource.transport.FakeFrameEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

final class RpcServerTest {

    private final RpcFrameCodec codec = new RpcFrameCodec(64 * 1024);
    private final FakeFrameEndpoint endpoint = new FakeFrameEndpoint();
    private final ExecutorService workers = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private RpcServer serverFor(ConfigurableCostSource plugin) {
        RpcServer server = new RpcServer(plugin, endpoint, codec, workers, new ManualMonotonicClock());
        endpoint.setListener(server);
        endpoint.start();
        return server;
    }

    private RpcFrame requestFor(CostSourceMethod method, Object request) {
        return RpcFrame.request(1, method.wireName(), 0, codec.encodeMessage(request));
    }

    @Test
    void successfulCallReturnsTheEncodedResponse() {
        RpcServer server = serverFor(ConfigurableCostSource.conforming());

        RpcFrame reply = server.dispatch(requestFor(CostSourceMethod.NAME, new NameRequest()), CallContext.background());

        assertEquals(StatusCode.OK, reply.status());
        assertEquals(new NameResponse("mock-test-plugin"), codec.decodeMessage(reply.payload(), NameResponse.class));
    }

    @Test
    void unknownMethodIsUnimplemented() {
        RpcServer server = serverFor(ConfigurableCostSource.conforming());

        RpcFrame reply = server.dispatch(RpcFrame.request(1, "DropTables", 0, new byte[0]), CallContext.background());

        assertEquals(StatusCode.UNIMPLEMENTED, reply.status());
        assertFalse(reply.implementationFault());
    }

    @Test
    void panicIsContainedAsAnInternalFault() {
        RpcServer server = serverFor(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .panic(CostSourceMethod.NAME, "boom")
            .build());

        RpcFrame reply = server.dispatch(requestFor(CostSourceMethod.NAME, new NameRequest()), CallContext.background());

        assertEquals(StatusCode.INTERNAL, reply.status());
        assertTrue(reply.implementationFault());
        assertEquals("implementation panicked: boom", reply.message());
    }

    @Test
    void statusThrownByTheImplementationIsPassedThrough() {
        RpcServer server = serverFor(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .fail(CostSourceMethod.NAME, StatusCode.PERMISSION_DENIED, "no")
            .build());

        RpcFrame reply = server.dispatch(requestFor(CostSourceMethod.NAME, new NameRequest()), CallContext.background());

        assertEquals(StatusCode.PERMISSION_DENIED, reply.status());
        assertEquals("no", reply.message());
        assertFalse(reply.implementationFault());
    }

    @Test
    void nullResponseIsAnInternalError() {
        RpcServer server = serverFor(ConfigurableCostSource.builder()
            .withConformingDefaults()
            .on(CostSourceMethod.NAME, MethodBehavior.respondWith(request -> null))
            .build());

        RpcFrame reply = server.dispatch(requestFor(CostSourceMethod.NAME, new NameRequest()), CallContext.background());

        assertEquals(StatusCode.INTERNAL, reply.status());
        assertEquals("Name returned no response", reply.message());
    }

    @Test
    void alreadyCancelledContextNeverReachesTheImplementation() {
        ConfigurableCostSource plugin = ConfigurableCostSource.conforming();
        RpcServer server = serverFor(plugin);
        CallContext ctx = CallContext.background();
        ctx.cancel();

        RpcFrame reply = server.dispatch(requestFor(CostSourceMethod.NAME, new NameRequest()), ctx);

        assertEquals(StatusCode.CANCELLED, reply.status());
        assertEquals(0, plugin.callCount(CostSourceMethod.NAME));
    }

    @Test
    void requestFrameIsAnsweredThroughTheEndpoint() throws Exception {
        serverFor(ConfigurableCostSource.conforming());

        endpoint.injectFrame(codec.encodeFrame(requestFor(CostSourceMethod.NAME, new NameRequest())));

        List<byte[]> sent = endpoint.awaitSent(1, 5_000);
        RpcFrame reply = codec.decodeFrame(sent.get(0));
        assertEquals(RpcFrame.Type.RESPONSE, reply.type());
        assertEquals(1, reply.callId());
        assertEquals(StatusCode.OK, reply.status());
    }

    @Test
    void undecodableFrameIsDiscarded() {
        RpcServer server = serverFor(ConfigurableCostSource.conforming());

        endpoint.injectFrame(new byte[] {1});

        assertEquals(0, server.inFlightCount());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void rejectedSubmissionAnswersUnavailable() {
        RpcServer server = serverFor(ConfigurableCostSource.conforming());
        workers.shutdown();

        endpoint.injectFrame(codec.encodeFrame(requestFor(CostSourceMethod.NAME, new NameRequest())));

        RpcFrame reply = codec.decodeFrame(endpoint.sent().get(0));
        assertEquals(StatusCode.UNAVAILABLE, reply.status());
        assertEquals(0, server.inFlightCount());
    }
}
