package com.questrail.costsource.conformance;

import com.questrail.costsource.api.CostSourceService;
import com.questrail.costsource.harness.HarnessException;
import com.questrail.costsource.observability.Slf4jConformanceObservabilitySink;

/**
 * Conformance
 * -----------------------------------------------------------------------------
 * One-call entry points for embedding the suite.
 *
 * <pre>{@code
 * ConformanceResult result = Conformance.runStandard(myPlugin);
 * if (!result.certifiedAt(ConformanceLevel.STANDARD)) {
 *     System.err.println(ConformanceReporter.formatReport(result));
 * }
 * }</pre>
 *
 * <p>Each entry point logs through SLF4J and otherwise uses the
 * {@link SuiteConfig} defaults for its level. Advanced runs use the longer
 * per-call timeout and the Advanced fan-out for every concurrency probe.
 * Every method throws {@link HarnessException} if the suite itself cannot
 * run.</p>
 */
public final class Conformance
{
    private Conformance()
    {
    }

    public static ConformanceResult runBasic(CostSourceService plugin)
    {
        return run(defaults(plugin).withLevel(ConformanceLevel.BASIC).build());
    }

    public static ConformanceResult runStandard(CostSourceService plugin)
    {
        return run(defaults(plugin).withLevel(ConformanceLevel.STANDARD).build());
    }

    public static ConformanceResult runAdvanced(CostSourceService plugin)
    {
        return run(defaults(plugin)
                .withLevel(ConformanceLevel.ADVANCED)
                .withTestTimeout(SuiteConfig.ADVANCED_TEST_TIMEOUT)
                .withConcurrencyFanOut(SuiteConfig.ADVANCED_FAN_OUT)
                .withAdvancedFanOut(SuiteConfig.ADVANCED_FAN_OUT)
                .build());
    }

    public static ConformanceResult run(SuiteConfig config)
    {
        return new ConformanceSuite(config).run();
    }

    private static SuiteConfig.Builder defaults(CostSourceService plugin)
    {
        return SuiteConfig.builder(plugin).withObservabilitySink(new Slf4jConformanceObservabilitySink());
    }
}
