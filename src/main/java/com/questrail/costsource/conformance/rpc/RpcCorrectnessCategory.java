package com.questrail.costsource.conformance.rpc;

import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetRecommendationsRequest;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.api.SupportsResponse;
import com.questrail.costsource.conformance.CallOutcomes;
import com.questrail.costsource.conformance.CategoryContext;
import com.questrail.costsource.conformance.ConformanceCategory;
import com.questrail.costsource.conformance.ConformanceFixtures;
import com.questrail.costsource.conformance.TestCategory;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.TestStatus;
import com.questrail.costsource.conformance.spec.CostSourceSchemas;
import com.questrail.costsource.conformance.spec.SchemaViolation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * RpcCorrectnessCategory
 * =============================================================================
 * Calls every contract method with valid and deliberately invalid input and
 * checks the status codes and response shapes that come back.
 *
 * <h2>Checks per method</h2>
 * <ul>
 *   <li>{@code <Method>RPC}: a minimal valid request succeeds with a
 *       well-formed response</li>
 *   <li>{@code <Method>_NilResource}: a missing resource descriptor is
 *       rejected with {@code INVALID_ARGUMENT}</li>
 *   <li>{@code <Method>_UnsupportedResource}: a resource from an unknown
 *       provider gets a defined rejection; {@code Supports} answers
 *       {@code supported=false} with a reason instead</li>
 *   <li>GetActualCost only: a missing resource id and inverted or zero-width
 *       time ranges are rejected with {@code INVALID_ARGUMENT}</li>
 *   <li>GetRecommendations only: a negative page size is rejected with
 *       {@code INVALID_ARGUMENT}</li>
 * </ul>
 *
 * <h2>Skips</h2>
 * An optional method that is not advertised, or whose valid call answers
 * {@code UNIMPLEMENTED}, has all of its checks skipped.
 */
public final class RpcCorrectnessCategory implements ConformanceCategory
{
    static final String PREFIX = "RPCCorrectness_";

    @Override
    public TestCategory category()
    {
        return TestCategory.RPC_CORRECTNESS;
    }

    @Override
    public List<TestResult> run(CategoryContext context)
    {
        List<TestResult> results = new ArrayList<>();
        for (CostSourceMethod method : CostSourceMethod.values()) {
            results.addAll(checkMethod(context, method));
        }
        return results;
    }

    private List<TestResult> checkMethod(CategoryContext context, CostSourceMethod method)
    {
        List<Check> checks = checksFor(method);
        List<TestResult> results = new ArrayList<>();

        if (!context.advertises(method)) {
            for (Check check : checks) {
                results.add(CategoryContext.notAdvertised(check.name(), category(), method));
            }
            return results;
        }

        TestResult first = validCall(context, method, checks.get(0).name());
        results.add(first);
        boolean unimplemented = first.status() == TestStatus.SKIPPED;

        for (Check check : checks.subList(1, checks.size())) {
            if (unimplemented) {
                results.add(TestResult.builder(check.name(), category())
                        .method(method)
                        .skipped(first.detail())
                        .build());
            }
            else {
                results.add(check.run(context, method));
            }
        }
        return results;
    }

    private List<Check> checksFor(CostSourceMethod method)
    {
        String base = PREFIX + method.wireName();
        List<Check> checks = new ArrayList<>();
        checks.add(new Check(base + "RPC", null));

        if (ConformanceFixtures.takesResource(method)) {
            checks.add(new Check(base + "_NilResource", (ctx, m) -> expectRejection(ctx, m, base + "_NilResource",
                    ConformanceFixtures.requestFor(m, null), StatusCode.INVALID_ARGUMENT)));
        }
        if (method == CostSourceMethod.GET_ACTUAL_COST) {
            checks.add(rangeCheck(base + "_MissingResourceId", new GetActualCostRequest("",
                    ConformanceFixtures.RANGE_START, ConformanceFixtures.RANGE_END)));
            checks.add(rangeCheck(base + "_InvertedRange", new GetActualCostRequest(ConformanceFixtures.RESOURCE_ID,
                    ConformanceFixtures.RANGE_END, ConformanceFixtures.RANGE_START)));
            checks.add(rangeCheck(base + "_ZeroWidthRange", new GetActualCostRequest(ConformanceFixtures.RESOURCE_ID,
                    ConformanceFixtures.RANGE_START, ConformanceFixtures.RANGE_START)));
        }
        if (method == CostSourceMethod.GET_RECOMMENDATIONS) {
            String name = base + "_NegativePageSize";
            checks.add(new Check(name, (ctx, m) -> expectRejection(ctx, m, name,
                    new GetRecommendationsRequest(null, -1, null), StatusCode.INVALID_ARGUMENT)));
        }
        if (method == CostSourceMethod.SUPPORTS) {
            checks.add(new Check(base + "_UnsupportedResource",
                    (ctx, m) -> supportsUnsupported(ctx, base + "_UnsupportedResource")));
        }
        else if (ConformanceFixtures.takesResource(method)) {
            String name = base + "_UnsupportedResource";
            checks.add(new Check(name, (ctx, m) -> expectRejection(ctx, m, name,
                    ConformanceFixtures.requestFor(m, ConformanceFixtures.UNSUPPORTED_RESOURCE),
                    StatusCode::isDefinedRejection, "a defined rejection code (not INTERNAL or UNKNOWN)")));
        }
        return checks;
    }

    private Check rangeCheck(String name, GetActualCostRequest request)
    {
        return new Check(name, (ctx, m) -> expectRejection(ctx, m, name, request, StatusCode.INVALID_ARGUMENT));
    }

    private TestResult validCall(CategoryContext context, CostSourceMethod method, String name)
    {
        TestResult.Builder result = TestResult.builder(name, category()).method(method);
        long start = context.clock().nowNanos();
        try {
            Object response = context.call(method, ConformanceFixtures.validRequest(method));
            List<SchemaViolation> violations = CostSourceSchemas.validate(method, response);
            if (violations.isEmpty()) {
                result.passed();
            }
            else {
                result.failed("malformed response: " + violations.get(0)
                        + (violations.size() > 1 ? " (+" + (violations.size() - 1) + " more)" : ""));
            }
        }
        catch (RpcException e) {
            CallOutcomes.apply(result, method, e);
        }
        return finish(context, result, start);
    }

    private TestResult supportsUnsupported(CategoryContext context, String name)
    {
        CostSourceMethod method = CostSourceMethod.SUPPORTS;
        TestResult.Builder result = TestResult.builder(name, category()).method(method);
        long start = context.clock().nowNanos();
        try {
            SupportsResponse response = (SupportsResponse) context.call(method,
                    ConformanceFixtures.requestFor(method, ConformanceFixtures.UNSUPPORTED_RESOURCE));
            if (response == null) {
                result.failed("Supports returned no response");
            }
            else if (response.supported()) {
                result.failed("Supports claimed provider '"
                        + ConformanceFixtures.UNSUPPORTED_RESOURCE.provider() + "' is supported");
            }
            else if (response.reason() == null || response.reason().isEmpty()) {
                result.failed("unsupported answer carries no reason");
            }
            else {
                result.passed();
            }
        }
        catch (RpcException e) {
            CallOutcomes.apply(result, method, e);
        }
        return finish(context, result, start);
    }

    private TestResult expectRejection(CategoryContext context, CostSourceMethod method, String name, Object request,
                                       StatusCode expected)
    {
        return expectRejection(context, method, name, request, code -> code == expected, expected.name());
    }

    private TestResult expectRejection(CategoryContext context, CostSourceMethod method, String name, Object request,
                                       Predicate<StatusCode> accepted, String expected)
    {
        TestResult.Builder result = TestResult.builder(name, category()).method(method);
        long start = context.clock().nowNanos();
        try {
            context.call(method, request);
            result.failed("expected " + expected + " but the call succeeded");
        }
        catch (RpcException e) {
            if (e.code().isInconclusive() || e.isImplementationFault()) {
                CallOutcomes.apply(result, method, e);
            }
            else if (accepted.test(e.code())) {
                result.passed().detail(e.code().name());
            }
            else {
                result.failed("expected " + expected + ", got " + CallOutcomes.describe(e));
            }
        }
        return finish(context, result, start);
    }

    private static TestResult finish(CategoryContext context, TestResult.Builder result, long start)
    {
        return result.duration(Duration.ofNanos(context.clock().elapsedSince(start))).build();
    }

    @FunctionalInterface
    private interface CheckBody
    {
        TestResult run(CategoryContext context, CostSourceMethod method);
    }

    private record Check(String name, CheckBody body)
    {
        TestResult run(CategoryContext context, CostSourceMethod method)
        {
            return body.run(context, method);
        }
    }
}
