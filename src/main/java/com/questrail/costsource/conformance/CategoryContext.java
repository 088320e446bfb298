package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.SupportsResponse;
import com.questrail.costsource.harness.CostSourceClient;
import com.questrail.costsource.internal.time.MonotonicClock;
import com.questrail.costsource.observability.ConformanceObservabilitySink;
import com.questrail.costsource.observability.ConformanceWarningEvent;
import com.questrail.costsource.rpc.CallOptions;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * CategoryContext
 * -----------------------------------------------------------------------------
 * What a {@link ConformanceCategory} is given to run against: the connected
 * client, the run configuration, and the capability flags read once from the
 * plugin's {@code Supports} answer.
 *
 * <p>Required methods are always considered advertised. Optional methods are
 * advertised only when the flag under their capability key is {@code true}.</p>
 */
public final class CategoryContext
{
    private final CostSourceClient client;
    private final SuiteConfig config;
    private final Map<String, Boolean> capabilities;
    private final MonotonicClock clock;

    public CategoryContext(CostSourceClient client, SuiteConfig config, Map<String, Boolean> capabilities,
                           MonotonicClock clock)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
        this.capabilities = (capabilities == null) ? Map.of() : Map.copyOf(capabilities);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CostSourceClient client()
    {
        return client;
    }

    public SuiteConfig config()
    {
        return config;
    }

    public ConformanceLevel level()
    {
        return config.level();
    }

    public MonotonicClock clock()
    {
        return clock;
    }

    public Map<String, Boolean> capabilities()
    {
        return capabilities;
    }

    public boolean advertises(CostSourceMethod method)
    {
        if (!method.isOptional()) {
            return true;
        }
        return Boolean.TRUE.equals(capabilities.get(method.capabilityKey()));
    }

    /**
     * Calls {@code method} with the per-test timeout.
     */
    public Object call(CostSourceMethod method, Object request)
    {
        return client.call(method, request, callOptions());
    }

    public CallOptions callOptions()
    {
        return CallOptions.withTimeout(config.testTimeout());
    }

    public ConformanceObservabilitySink sink()
    {
        return config.observabilitySink();
    }

    public void warn(TestCategory category, String testName, String message)
    {
        sink().onWarning(new ConformanceWarningEvent(Instant.now(), category, testName, message));
    }

    /**
     * Result for an optional method the plugin does not advertise.
     */
    public static TestResult notAdvertised(String testName, TestCategory category, CostSourceMethod method)
    {
        return TestResult.builder(testName, category)
                .method(method)
                .skipped("capability '" + method.capabilityKey() + "' not advertised")
                .build();
    }

    /**
     * Capability flags taken from a {@code Supports} answer, empty when there
     * was none.
     */
    public static Map<String, Boolean> capabilitiesOf(SupportsResponse response)
    {
        return (response == null || response.capabilities() == null) ? Map.of() : response.capabilities();
    }
}
