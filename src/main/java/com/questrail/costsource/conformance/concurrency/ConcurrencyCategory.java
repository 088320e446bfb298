package com.questrail.costsource.conformance.concurrency;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.conformance.CallOutcomes;
import com.questrail.costsource.conformance.CategoryContext;
import com.questrail.costsource.conformance.ConformanceCategory;
import com.questrail.costsource.conformance.ConformanceFixtures;
import com.questrail.costsource.conformance.ConformanceLevel;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.spec.CostSourceSchemas;
import com.questrail.costsource.conformance.spec.SchemaViolation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * ConcurrencyCategory
 * =============================================================================
 * Fans out identical calls to each method and checks the replies agree.
 *
 * <h2>Probes</h2>
 * <ul>
 *   <li>{@code Concurrency_<Method>_ParallelRequests_Standard}:
 *       {@code concurrencyFanOut} simultaneous calls</li>
 *   <li>{@code Concurrency_<Method>_ParallelRequests_Advanced}: Advanced runs
 *       only, {@code advancedFanOut} simultaneous calls, gating Advanced</li>
 * </ul>
 * A probe that ends {@link ProbeState#FAILED} skips the remaining probes for
 * that method. Other methods are unaffected.
 *
 * <h2>Verification</h2>
 * Deterministic methods (Name, Supports, GetProjectedCost, GetPricingSpec)
 * must return identical responses. The others may legitimately vary per call,
 * so each of their responses must pass the structural rules instead.
 *
 * <h2>Race detection</h2>
 * Identical replies under load do not prove the absence of data races. Unless
 * the run declares a race-detecting agent, every result carries a warning
 * saying so.
 */
public final class ConcurrencyCategory implements ConformanceCategory
{
    static final String RACE_DETECTION_WARNING =
            "race detection was not active; concurrency safety is not verified";

    @Override
    public TestCategory category()
    {
        return TestCategory.CONCURRENCY;
    }

    @Override
    public List<TestResult> run(CategoryContext context)
    {
        boolean advanced = context.level() == ConformanceLevel.ADVANCED;
        boolean raceDetection = context.config().raceDetectionActive();
        if (!raceDetection) {
            context.warn(category(), category().displayName(), RACE_DETECTION_WARNING);
        }

        List<TestResult> results = new ArrayList<>();
        for (CostSourceMethod method : CostSourceMethod.values()) {
            List<Probe> probes = new ArrayList<>();
            probes.add(new Probe(testName(method, "Standard"), ConformanceLevel.STANDARD,
                    context.config().concurrencyFanOut()));
            if (advanced) {
                probes.add(new Probe(testName(method, "Advanced"), ConformanceLevel.ADVANCED,
                        context.config().advancedFanOut()));
            }

            String shortCircuit = null;
            for (Probe probe : probes) {
                TestResult.Builder result = TestResult.builder(probe.name(), category())
                        .method(method)
                        .level(probe.level());
                if (!raceDetection) {
                    result.warning(RACE_DETECTION_WARNING);
                }

                if (!context.advertises(method)) {
                    result.skipped("capability '" + method.capabilityKey() + "' not advertised");
                }
                else if (shortCircuit != null) {
                    result.skipped(shortCircuit);
                }
                else {
                    ProbeState end = runProbe(context, method, probe, result);
                    if (end == ProbeState.FAILED) {
                        shortCircuit = "skipped after an earlier probe of " + method.wireName() + " failed";
                    }
                }
                results.add(result.build());
            }
        }
        return results;
    }

    static String testName(CostSourceMethod method, String level)
    {
        return "Concurrency_" + method.wireName() + "_ParallelRequests_" + level;
    }

    static boolean isDeterministic(CostSourceMethod method)
    {
        return switch (method) {
            case NAME, SUPPORTS, GET_PROJECTED_COST, GET_PRICING_SPEC -> true;
            default -> false;
        };
    }

    private ProbeState runProbe(CategoryContext context, CostSourceMethod method, Probe probe,
                                TestResult.Builder result)
    {
        FanOutProbe fanOut = new FanOutProbe(context.client(), method, ConformanceFixtures.validRequest(method),
                probe.fanOut(), context.config().testTimeout());

        long start = context.clock().nowNanos();
        FanOutProbe.ProbeResult outcome = fanOut.run(responses -> isDeterministic(method)
                ? verifyIdentical(responses)
                : verifyEachValid(method, responses));
        result.duration(Duration.ofNanos(context.clock().elapsedSince(start)))
                .metric("fan_out", probe.fanOut())
                .metric("replies", outcome.replies().size());

        List<RpcException> errors = outcome.errors();
        if (!errors.isEmpty()) {
            result.metric("errors", errors.size());
            // the most telling error decides the outcome
            RpcException first = errors.stream()
                    .filter(e -> !e.code().isInconclusive())
                    .findFirst()
                    .orElse(errors.get(0));
            TestResult classified = CallOutcomes.apply(result, method, first).build();
            if (classified.status().blocksCertification()) {
                result.detail(errors.size() + " of " + probe.fanOut() + " calls failed; first: "
                        + classified.detail());
            }
        }
        else if (outcome.failure().isPresent()) {
            result.failed(outcome.failure().get());
        }
        else {
            result.passed().detail(probe.fanOut() + (isDeterministic(method)
                    ? " identical responses"
                    : " well-formed responses"));
        }
        return outcome.state();
    }

    static Optional<String> verifyIdentical(List<Object> responses)
    {
        Set<Object> distinct = new HashSet<>(responses);
        if (distinct.size() <= 1) {
            return Optional.empty();
        }
        return Optional.of(distinct.size() + " distinct responses among " + responses.size()
                + " identical calls");
    }

    static Optional<String> verifyEachValid(CostSourceMethod method, List<Object> responses)
    {
        int invalid = 0;
        SchemaViolation firstViolation = null;
        for (Object response : responses) {
            List<SchemaViolation> violations = CostSourceSchemas.validate(method, response);
            if (!violations.isEmpty()) {
                invalid++;
                if (firstViolation == null) {
                    firstViolation = violations.get(0);
                }
            }
        }
        if (invalid == 0) {
            return Optional.empty();
        }
        return Optional.of(invalid + " of " + responses.size() + " responses malformed; first: " + firstViolation);
    }

    private record Probe(String name, ConformanceLevel level, int fanOut)
    {
    }
}
