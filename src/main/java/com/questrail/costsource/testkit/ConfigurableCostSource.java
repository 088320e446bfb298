package com.questrail.costsource.testkit;

import com.questrail.costsource.api.CallContext;
import com.questrail.costsource.api.CostSourceMethod;
import com.questrail.costsource.api.CostSourceService;
import com.questrail.costsource.api.EstimateCostRequest;
import com.questrail.costsource.api.EstimateCostResponse;
import com.questrail.costsource.api.GetActualCostRequest;
import com.questrail.costsource.api.GetActualCostResponse;
import com.questrail.costsource.api.GetBudgetsRequest;
import com.questrail.costsource.api.GetBudgetsResponse;
import com.questrail.costsource.api.GetPricingSpecRequest;
import com.questrail.costsource.api.GetPricingSpecResponse;
import com.questrail.costsource.api.GetProjectedCostRequest;
import com.questrail.costsource.api.GetProjectedCostResponse;
import com.questrail.costsource.api.GetRecommendationsRequest;
import com.questrail.costsource.api.GetRecommendationsResponse;
import com.questrail.costsource.api.NameRequest;
import com.questrail.costsource.api.NameResponse;
import com.questrail.costsource.api.ResourceDescriptor;
import com.questrail.costsource.api.RpcException;
import com.questrail.costsource.api.StatusCode;
import com.questrail.costsource.api.SupportsRequest;
import com.questrail.costsource.api.SupportsResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * ConfigurableCostSource
 * =============================================================================
 * Scriptable {@link CostSourceService} for driving the harness under
 * controlled conditions.
 *
 * <h2>Per-method configuration</h2>
 * Each contract method is given a {@link MethodBehavior} (canned response,
 * canned error status, or injected fault) and optionally an artificial delay.
 * A method left unconfigured answers {@link StatusCode#UNIMPLEMENTED}.
 *
 * <h2>Capability advertisement</h2>
 * {@code Supports} advertises exactly the optional methods that are
 * configured; the advertisement is derived from the configuration rather than
 * set separately, so it cannot drift from what the double actually serves.
 *
 * <h2>Request validation</h2>
 * Unless disabled, requests are checked before the behavior runs, the way a
 * well-behaved plugin would:
 * <ul>
 *   <li>a missing request, descriptor or resource id: {@code INVALID_ARGUMENT}</li>
 *   <li>a missing, inverted or zero-width time range: {@code INVALID_ARGUMENT}</li>
 *   <li>a negative page size: {@code INVALID_ARGUMENT}</li>
 *   <li>a provider outside {@link Builder#withSupportedProviders}:
 *       {@code supported=false} from {@code Supports}, {@code NOT_FOUND}
 *       elsewhere</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Configuration is fixed at {@link Builder#build()}; the built double has no
 * mutators, so concurrent dispatch only ever reads it. The request log is a
 * concurrent queue.
 */
public final class ConfigurableCostSource implements CostSourceService
{
    private final Map<CostSourceMethod, MethodBehavior> behaviors;
    private final Map<CostSourceMethod, Duration> delays;
    private final Set<String> supportedProviders;
    private final boolean validateRequests;
    private final Map<String, Boolean> capabilities;

    /** Stands in for the derived {@code Supports} answer until the double is built. */
    private static final MethodBehavior ADVERTISE = MethodBehavior.respondWith(request -> {
        throw new IllegalStateException("capability advertisement was not resolved");
    });

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentLinkedQueue<RecordedCall> calls = new ConcurrentLinkedQueue<>();

    private ConfigurableCostSource(Builder b)
    {
        Map<CostSourceMethod, MethodBehavior> configured = new EnumMap<>(CostSourceMethod.class);
        configured.putAll(b.behaviors);
        this.delays = Collections.unmodifiableMap(new EnumMap<>(b.delays));
        this.supportedProviders = Set.copyOf(b.supportedProviders);
        this.validateRequests = b.validateRequests;

        Map<String, Boolean> caps = new LinkedHashMap<>();
        for (CostSourceMethod m : CostSourceMethod.values()) {
            if (m.isOptional()) {
                caps.put(m.capabilityKey(), configured.containsKey(m));
            }
        }
        this.capabilities = Collections.unmodifiableMap(caps);

        if (configured.get(CostSourceMethod.SUPPORTS) == ADVERTISE) {
            configured.put(CostSourceMethod.SUPPORTS,
                    MethodBehavior.respond(SupportsResponse.supported(capabilities)));
        }
        this.behaviors = Collections.unmodifiableMap(configured);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * A double that answers every method with a well-formed canned response.
     */
    public static ConfigurableCostSource conforming()
    {
        return builder().withConformingDefaults().build();
    }

    /** Capability flags advertised by {@code Supports}. */
    public Map<String, Boolean> capabilities()
    {
        return capabilities;
    }

    public boolean isConfigured(CostSourceMethod method)
    {
        return behaviors.containsKey(method);
    }

    // ---------------------------------------------------------------------
    // Request log
    // ---------------------------------------------------------------------

    public List<RecordedCall> recordedCalls()
    {
        return List.copyOf(calls);
    }

    public List<RecordedCall> recordedCalls(CostSourceMethod method)
    {
        return calls.stream().filter(c -> c.method() == method).toList();
    }

    /**
     * Requests received by {@code method}, in arrival order. A call made
     * without a request body appears as {@code null}.
     */
    public <T> List<T> requestsFor(CostSourceMethod method, Class<T> type)
    {
        List<T> out = new ArrayList<>();
        for (RecordedCall c : calls) {
            if (c.method() == method) {
                out.add(type.cast(c.request()));
            }
        }
        return out;
    }

    public int callCount(CostSourceMethod method)
    {
        return (int) calls.stream().filter(c -> c.method() == method).count();
    }

    // ---------------------------------------------------------------------
    // Contract
    // ---------------------------------------------------------------------

    @Override
    public NameResponse name(CallContext ctx, NameRequest request)
    {
        return (NameResponse) handle(CostSourceMethod.NAME, ctx, request);
    }

    @Override
    public SupportsResponse supports(CallContext ctx, SupportsRequest request)
    {
        return (SupportsResponse) handle(CostSourceMethod.SUPPORTS, ctx, request);
    }

    @Override
    public GetActualCostResponse getActualCost(CallContext ctx, GetActualCostRequest request)
    {
        return (GetActualCostResponse) handle(CostSourceMethod.GET_ACTUAL_COST, ctx, request);
    }

    @Override
    public GetProjectedCostResponse getProjectedCost(CallContext ctx, GetProjectedCostRequest request)
    {
        return (GetProjectedCostResponse) handle(CostSourceMethod.GET_PROJECTED_COST, ctx, request);
    }

    @Override
    public GetPricingSpecResponse getPricingSpec(CallContext ctx, GetPricingSpecRequest request)
    {
        return (GetPricingSpecResponse) handle(CostSourceMethod.GET_PRICING_SPEC, ctx, request);
    }

    @Override
    public EstimateCostResponse estimateCost(CallContext ctx, EstimateCostRequest request)
    {
        return (EstimateCostResponse) handle(CostSourceMethod.ESTIMATE_COST, ctx, request);
    }

    @Override
    public GetRecommendationsResponse getRecommendations(CallContext ctx, GetRecommendationsRequest request)
    {
        return (GetRecommendationsResponse) handle(CostSourceMethod.GET_RECOMMENDATIONS, ctx, request);
    }

    @Override
    public GetBudgetsResponse getBudgets(CallContext ctx, GetBudgetsRequest request)
    {
        return (GetBudgetsResponse) handle(CostSourceMethod.GET_BUDGETS, ctx, request);
    }

    private Object handle(CostSourceMethod method, CallContext ctx, Object request)
    {
        calls.add(new RecordedCall(sequence.getAndIncrement(), method, request));

        Duration delay = delays.get(method);
        if (delay != null) {
            ctx.sleep(delay);
        }

        MethodBehavior behavior = behaviors.get(method);
        if (behavior == null) {
            throw RpcException.unimplemented(method.wireName());
        }

        if (validateRequests) {
            Object rejection = validate(method, request);
            if (rejection != null) {
                return rejection;
            }
        }

        Object response = behavior.execute(ctx, request);
        if (response != null && !method.responseType().isInstance(response)) {
            throw new IllegalStateException(method.wireName() + " configured with a "
                    + response.getClass().getSimpleName() + " response");
        }
        return response;
    }

    /**
     * Throws for invalid requests; returns a substitute response when the
     * request is valid but must be declined ({@code Supports} for an unknown
     * provider); otherwise {@code null}.
     */
    private Object validate(CostSourceMethod method, Object request)
    {
        if (method == CostSourceMethod.NAME) {
            return null;
        }
        if (request == null) {
            throw RpcException.invalidArgument("request is required");
        }

        switch (method) {
            case SUPPORTS -> {
                ResourceDescriptor r = requireResource(((SupportsRequest) request).resource());
                if (!supportedProviders.contains(r.provider())) {
                    return SupportsResponse.unsupported(
                            "provider '" + r.provider() + "' is not supported", capabilities);
                }
            }
            case GET_PROJECTED_COST -> requireSupported(((GetProjectedCostRequest) request).resource());
            case GET_PRICING_SPEC -> requireSupported(((GetPricingSpecRequest) request).resource());
            case ESTIMATE_COST -> requireSupported(((EstimateCostRequest) request).resource());
            case GET_ACTUAL_COST -> {
                GetActualCostRequest r = (GetActualCostRequest) request;
                if (r.resourceId() == null || r.resourceId().isBlank()) {
                    throw RpcException.invalidArgument("resource_id is required");
                }
                if (r.start() == null || r.end() == null) {
                    throw RpcException.invalidArgument("start and end time are required");
                }
                if (!r.end().isAfter(r.start())) {
                    throw RpcException.invalidArgument("end time must be after start time");
                }
            }
            case GET_RECOMMENDATIONS -> {
                GetRecommendationsRequest r = (GetRecommendationsRequest) request;
                if (r.pageSize() < 0) {
                    throw RpcException.invalidArgument("page_size must be non-negative");
                }
                requireKnownProvider(r.provider());
            }
            case GET_BUDGETS -> requireKnownProvider(((GetBudgetsRequest) request).provider());
            default -> {
            }
        }
        return null;
    }

    private static ResourceDescriptor requireResource(ResourceDescriptor resource)
    {
        if (resource == null) {
            throw RpcException.invalidArgument("resource descriptor is required");
        }
        if (resource.provider() == null || resource.provider().isBlank()) {
            throw RpcException.invalidArgument("resource provider is required");
        }
        return resource;
    }

    private void requireSupported(ResourceDescriptor resource)
    {
        ResourceDescriptor r = requireResource(resource);
        if (!supportedProviders.contains(r.provider())) {
            throw RpcException.notFound("provider '" + r.provider() + "' is not supported");
        }
    }

    private void requireKnownProvider(String provider)
    {
        if (provider != null && !provider.isBlank() && !supportedProviders.contains(provider)) {
            throw RpcException.notFound("provider '" + provider + "' is not supported");
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final Map<CostSourceMethod, MethodBehavior> behaviors = new EnumMap<>(CostSourceMethod.class);
        private final Map<CostSourceMethod, Duration> delays = new EnumMap<>(CostSourceMethod.class);
        private Set<String> supportedProviders = CannedResponses.PROVIDERS;
        private boolean validateRequests = true;

        private Builder() {
        }

        /**
         * Configures every method, {@code Supports} included, with a
         * well-formed canned response.
         */
        public Builder withConformingDefaults() {
            respond(CostSourceMethod.NAME, CannedResponses.name());
            respondWith(CostSourceMethod.GET_ACTUAL_COST,
                    r -> CannedResponses.actualCost((GetActualCostRequest) r));
            respond(CostSourceMethod.GET_PROJECTED_COST, CannedResponses.projectedCost());
            respondWith(CostSourceMethod.GET_PRICING_SPEC,
                    r -> CannedResponses.pricingSpec((GetPricingSpecRequest) r));
            respond(CostSourceMethod.ESTIMATE_COST, CannedResponses.estimateCost());
            respond(CostSourceMethod.GET_RECOMMENDATIONS, CannedResponses.recommendations());
            respondWith(CostSourceMethod.GET_BUDGETS,
                    r -> CannedResponses.budgets((GetBudgetsRequest) r));
            return advertiseSupport();
        }

        /**
         * {@code Supports} answers {@code supported=true} with the derived
         * capability flags.
         */
        public Builder advertiseSupport() {
            behaviors.put(CostSourceMethod.SUPPORTS, ADVERTISE);
            return this;
        }

        public Builder withName(String name) {
            return respond(CostSourceMethod.NAME, new NameResponse(name));
        }

        public Builder respond(CostSourceMethod method, Object response) {
            Objects.requireNonNull(response, "response");
            if (!method.responseType().isInstance(response)) {
                throw new IllegalArgumentException(method.wireName() + " responds with "
                        + method.responseType().getSimpleName() + ", not " + response.getClass().getSimpleName());
            }
            return on(method, MethodBehavior.respond(response));
        }

        public Builder respondWith(CostSourceMethod method, Function<Object, Object> responder) {
            return on(method, MethodBehavior.respondWith(responder));
        }

        public Builder fail(CostSourceMethod method, StatusCode code, String message) {
            return on(method, MethodBehavior.fail(code, message));
        }

        public Builder panic(CostSourceMethod method, String message) {
            return on(method, MethodBehavior.panic(message));
        }

        public Builder on(CostSourceMethod method, MethodBehavior behavior) {
            behaviors.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(behavior, "behavior"));
            return this;
        }

        /**
         * Removes any behavior: the method answers {@code UNIMPLEMENTED} and,
         * if optional, is no longer advertised.
         */
        public Builder unconfigure(CostSourceMethod method) {
            behaviors.remove(method);
            return this;
        }

        public Builder delay(CostSourceMethod method, Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must be non-negative");
            }
            delays.put(method, delay);
            return this;
        }

        public Builder withSupportedProviders(Set<String> providers) {
            this.supportedProviders = Set.copyOf(providers);
            return this;
        }

        public Builder withRequestValidation(boolean validate) {
            this.validateRequests = validate;
            return this;
        }

        public ConfigurableCostSource build() {
            return new ConfigurableCostSource(this);
        }
    }
}
