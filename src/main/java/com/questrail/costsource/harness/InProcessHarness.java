package com.questrail.costsource.harness;

import com.questrail.costsource.api.CostSourceService;
import com.questrail.costsource.internal.time.MonotonicClock;
import com.questrail.costsource.internal.time.SystemMonotonicClock;
import com.questrail.costsource.rpc.RpcClient;
import com.questrail.costsource.rpc.RpcFrameCodec;
import com.questrail.costsource.rpc.RpcServer;
import com.questrail.costsource.transport.FrameEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InProcessHarness
 * =============================================================================
 * Composition root and lifecycle owner for one in-memory client/server binding.
 *
 * <h2>What it wires</h2>
 * <ul>
 *   <li>a server {@link FrameEndpoint} and an {@link RpcServer} dispatching to
 *       the bound implementation on a dedicated worker pool</li>
 *   <li>a client {@link FrameEndpoint} and an {@link RpcClient}</li>
 *   <li>a shared {@link RpcFrameCodec} enforcing the message size limit</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #start(CostSourceService)} binds an implementation and returns a
 * connected {@link CostSourceClient}; {@link #stop()} tears everything down and
 * may be called any number of times. The harness is {@link AutoCloseable} so
 * callers can guarantee teardown on every exit path:
 * <pre>{@code
 * try (InProcessHarness harness = InProcessHarness.builder().build()) {
 *     CostSourceClient client = harness.start(plugin);
 *     ...
 * }
 * }</pre>
 *
 * <p>A harness binds at most one implementation at a time and is not meant to
 * be shared between concurrent runs. Callers drain or cancel outstanding calls
 * before {@link #stop()}; calls still pending at that point fail with
 * {@code UNAVAILABLE}.</p>
 */
public final class InProcessHarness implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InProcessHarness.class);

    private static final AtomicLong CHANNEL_SEQUENCE = new AtomicLong();

    /** Room for the frame header on top of the largest message. */
    static final int FRAME_OVERHEAD_BYTES = 64 * 1024;

    private final int maxMessageBytes;
    private final Duration defaultTimeout;
    private final int workerThreads;
    private final EndpointFactory endpointFactory;
    private final MonotonicClock clock;

    private Binding bound;

    private InProcessHarness(Builder b) {
        this.maxMessageBytes = b.maxMessageBytes;
        this.defaultTimeout = b.defaultTimeout;
        this.workerThreads = b.workerThreads;
        this.endpointFactory = b.endpointFactory;
        this.clock = b.clock;
    }

    /**
     * Binds {@code implementation} and returns a connected client.
     *
     * @throws HarnessException if an implementation is already bound or the
     *                          in-memory channel cannot be established
     */
    public synchronized CostSourceClient start(CostSourceService implementation) {
        Objects.requireNonNull(implementation, "implementation");
        if (bound != null) {
            throw new HarnessException("an implementation is already bound to this harness");
        }

        String channelId = "costsource-harness-" + CHANNEL_SEQUENCE.incrementAndGet();
        int maxFrameBytes = maxMessageBytes + FRAME_OVERHEAD_BYTES;

        RpcFrameCodec codec = new RpcFrameCodec(maxMessageBytes);
        ExecutorService workers = Executors.newFixedThreadPool(workerThreads, workerThreadFactory(channelId));

        FrameEndpoint serverEndpoint = endpointFactory.server(channelId, maxFrameBytes);
        FrameEndpoint clientEndpoint = endpointFactory.client(channelId, maxFrameBytes);

        RpcServer server = new RpcServer(implementation, serverEndpoint, codec, workers, clock);
        RpcClient client = new RpcClient(clientEndpoint, codec, defaultTimeout, clock);
        serverEndpoint.setListener(server);
        clientEndpoint.setListener(client);

        Binding binding = new Binding(serverEndpoint, clientEndpoint, client, workers);
        try {
            serverEndpoint.start();
            clientEndpoint.start();
        } catch (RuntimeException e) {
            binding.release();
            throw new HarnessException("failed to establish in-memory channel '" + channelId + "'", e);
        }

        bound = binding;
        log.info("Harness bound {} on channel '{}'", implementation.getClass().getSimpleName(), channelId);
        return new CostSourceClient(client);
    }

    /**
     * Tears down the channel and releases the worker pool. Idempotent.
     */
    public synchronized void stop() {
        Binding b = bound;
        if (b == null) {
            return;
        }
        bound = null;
        b.release();
        log.info("Harness stopped");
    }

    public synchronized boolean isStarted() {
        return bound != null;
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static ThreadFactory workerThreadFactory(String channelId) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, channelId + "-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Binding(
            FrameEndpoint serverEndpoint,
            FrameEndpoint clientEndpoint,
            RpcClient client,
            ExecutorService workers
    ) {
        void release() {
            client.close();
            clientEndpoint.stop();
            serverEndpoint.stop();
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public static final class Builder {
        private int maxMessageBytes = RpcFrameCodec.DEFAULT_MAX_MESSAGE_BYTES;
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private int workerThreads = 64;
        private EndpointFactory endpointFactory = EndpointFactory.nettyLocal();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withMaxMessageBytes(int bytes) {
            this.maxMessageBytes = bytes;
            return this;
        }

        public Builder withDefaultTimeout(Duration timeout) {
            this.defaultTimeout = timeout;
            return this;
        }

        /**
         * Server worker pool size; bounds how many calls the implementation
         * sees truly in parallel.
         */
        public Builder withWorkerThreads(int threads) {
            this.workerThreads = threads;
            return this;
        }

        public Builder withEndpointFactory(EndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public InProcessHarness build() {
            Objects.requireNonNull(defaultTimeout, "defaultTimeout");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            Objects.requireNonNull(clock, "clock");
            if (maxMessageBytes <= 0) {
                throw new IllegalArgumentException("maxMessageBytes must be positive");
            }
            if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
                throw new IllegalArgumentException("defaultTimeout must be positive");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1");
            }
            return new InProcessHarness(this);
        }
    }
}
