package com.questrail.costsource.conformance;

import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.SupportsRequest;
import com.questrail.costsource.api.SupportsResponse;
import com.questrail.costsource.conformance.concurrency.ConcurrencyCategory;
import com.questrail.costsource.conformance.perf.PerformanceCategory;
import com.questrail.costsource.conformance.report.ResultAggregator;
import com.questrail.costsource.conformance.rpc.RpcCorrectnessCategory;
import com.questrail.costsource.conformance.spec.SpecValidationCategory;
import com.questrail.costsource.harness.CostSourceClient;
import com.questrail.costsource.harness.EndpointFactory;
import com.questrail.costsource.harness.HarnessException;
import com.questrail.costsource.harness.InProcessHarness;
import com.questrail.costsource.internal.time.MonotonicClock;
import com.questrail.costsource.internal.time.SystemMonotonicClock;
import com.questrail.costsource.observability.ConformanceErrorEvent;
import com.questrail.costsource.observability.ConformanceObservabilitySink;
import com.questrail.costsource.rpc.CallOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ConformanceSuite
 * =============================================================================
 * Runs the category modules against one plugin and produces the certification
 * verdict.
 *
 * <h2>Run order</h2>
 * Categories always run in {@link TestCategory} order. Specification
 * validation and RPC correctness run at every level; performance and
 * concurrency only when Standard or Advanced is requested. A structural
 * failure does not stop later categories: they still run so the report is
 * complete, and the failure alone keeps the level below Basic.
 *
 * <h2>Capability probe</h2>
 * Before any category runs, the suite asks the plugin for its {@code Name}
 * and its {@code Supports} answer for a standard resource. Those capability
 * flags are the only ones the categories see. A plugin that fails either
 * call is treated as nameless and advertising nothing.
 *
 * <h2>Errors</h2>
 * Contract problems are results, never exceptions. Only
 * {@link HarnessException} escapes {@link #run}: the in-memory channel could
 * not be set up, or a category module itself broke.
 *
 * <p>Each run binds its own {@link InProcessHarness} and tears it down before
 * returning. The suite holds no state between runs, so separate suites may
 * run concurrently.</p>
 */
public final class ConformanceSuite
{
    private static final Logger log = LoggerFactory.getLogger(ConformanceSuite.class);

    /** Lower bound on server workers so fan-out calls are served in parallel. */
    static final int MIN_WORKER_THREADS = 64;

    private final SuiteConfig config;
    private final MonotonicClock clock;
    private final EndpointFactory endpointFactory;
    private final Map<TestCategory, ConformanceCategory> modules;

    public ConformanceSuite(SuiteConfig config)
    {
        this(config, SystemMonotonicClock.INSTANCE, EndpointFactory.nettyLocal(), defaultModules());
    }

    ConformanceSuite(SuiteConfig config, MonotonicClock clock, EndpointFactory endpointFactory,
                     List<ConformanceCategory> modules)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.modules = new EnumMap<>(TestCategory.class);
        for (ConformanceCategory module : modules) {
            this.modules.put(module.category(), module);
        }
    }

    static List<ConformanceCategory> defaultModules()
    {
        return List.of(
                new SpecValidationCategory(),
                new RpcCorrectnessCategory(),
                new PerformanceCategory(),
                new ConcurrencyCategory());
    }

    public SuiteConfig config()
    {
        return config;
    }

    /**
     * Runs at the configured level.
     */
    public ConformanceResult run()
    {
        return run(config.level());
    }

    /**
     * Runs every category required at {@code level}.
     *
     * @throws HarnessException if the suite itself cannot run
     */
    public ConformanceResult run(ConformanceLevel level)
    {
        SuiteConfig cfg = config.withLevel(Objects.requireNonNull(level, "level"));
        ConformanceObservabilitySink sink = cfg.observabilitySink();
        long start = clock.nowNanos();

        try (InProcessHarness harness = newHarness(cfg)) {
            CostSourceClient client = harness.start(cfg.target());
            Probe probe = probe(client, cfg);
            sink.onSuiteStarted(probe.pluginName(), level);

            CategoryContext context = new CategoryContext(client, cfg, probe.capabilities(), clock);
            List<TestResult> all = new ArrayList<>();
            for (TestCategory category : TestCategory.values()) {
                if (category.requiredAt(level)) {
                    all.addAll(runModule(category, context).results());
                }
            }

            ConformanceResult result = ResultAggregator.aggregate(probe.pluginName(), level, all,
                    Duration.ofNanos(clock.elapsedSince(start)));
            sink.onSuiteCompleted(result);
            return result;
        }
        catch (HarnessException e) {
            sink.onError(new ConformanceErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Runs one category in isolation, whatever the configured level.
     *
     * @throws HarnessException if the suite itself cannot run
     */
    public CategoryResult runCategory(TestCategory category)
    {
        Objects.requireNonNull(category, "category");
        ConformanceObservabilitySink sink = config.observabilitySink();

        try (InProcessHarness harness = newHarness(config)) {
            CostSourceClient client = harness.start(config.target());
            Probe probe = probe(client, config);
            return runModule(category, new CategoryContext(client, config, probe.capabilities(), clock));
        }
        catch (HarnessException e) {
            sink.onError(new ConformanceErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    private CategoryResult runModule(TestCategory category, CategoryContext context)
    {
        ConformanceObservabilitySink sink = context.sink();
        ConformanceCategory module = modules.get(category);
        if (module == null) {
            log.warn("No module registered for category {}", category.id());
            CategoryResult unattempted = CategoryResult.unattempted(category);
            sink.onCategoryCompleted(unattempted);
            return unattempted;
        }

        sink.onCategoryStarted(category);
        List<TestResult> results;
        try {
            results = module.run(context);
        }
        catch (HarnessException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new HarnessException("category " + category.id() + " aborted", e);
        }

        for (TestResult r : results) {
            sink.onTestCompleted(r);
        }
        CategoryResult result = ResultAggregator.categoryResult(category, results);
        sink.onCategoryCompleted(result);
        return result;
    }

    private InProcessHarness newHarness(SuiteConfig cfg)
    {
        int fanOut = Math.max(cfg.concurrencyFanOut(), cfg.advancedFanOut());
        return InProcessHarness.builder()
                .withMaxMessageBytes(cfg.maxMessageBytes())
                .withDefaultTimeout(cfg.testTimeout())
                .withWorkerThreads(Math.max(MIN_WORKER_THREADS, fanOut))
                .withEndpointFactory(endpointFactory)
                .withClock(clock)
                .build();
    }

    private Probe probe(CostSourceClient client, SuiteConfig cfg)
    {
        String name = "";
        try {
            NameResponse response = client.name(new NameRequest(), CallOptions.withTimeout(cfg.testTimeout()));
            if (response != null && response.name() != null) {
                name = response.name();
            }
        }
        catch (RpcException e) {
            log.warn("Name probe failed: {}", e.toString());
        }

        Map<String, Boolean> capabilities = Map.of();
        try {
            SupportsResponse response = client.supports(new SupportsRequest(ConformanceFixtures.STANDARD_RESOURCE),
                    CallOptions.withTimeout(cfg.testTimeout()));
            capabilities = CategoryContext.capabilitiesOf(response);
        }
        catch (RpcException e) {
            log.warn("Supports probe failed, assuming no optional capabilities: {}", e.toString());
        }
        log.debug("Probed plugin '{}' with capabilities {}", name, capabilities);
        return new Probe(name, capabilities);
    }

    private record Probe(String pluginName, Map<String, Boolean> capabilities)
    {
    }
}
