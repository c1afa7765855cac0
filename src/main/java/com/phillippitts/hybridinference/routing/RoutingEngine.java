package com.phillippitts.hybridinference.routing;

import com.phillippitts.hybridinference.cloud.CloudProvider;
import com.phillippitts.hybridinference.cloud.CloudProviderRegistry;
import com.phillippitts.hybridinference.cloud.ProviderFailoverChain;
import com.phillippitts.hybridinference.cloud.ProviderStream;
import com.phillippitts.hybridinference.config.properties.RoutingProperties;
import com.phillippitts.hybridinference.cost.CloudCostTracker;
import com.phillippitts.hybridinference.cost.CostSummary;
import com.phillippitts.hybridinference.domain.CloudGenerationOptions;
import com.phillippitts.hybridinference.domain.CloudGenerationResult;
import com.phillippitts.hybridinference.domain.GenerationOptions;
import com.phillippitts.hybridinference.domain.HandoffReason;
import com.phillippitts.hybridinference.domain.LlmGenerationResult;
import com.phillippitts.hybridinference.domain.RoutedGenerationResult;
import com.phillippitts.hybridinference.domain.RoutedStreamingResult;
import com.phillippitts.hybridinference.domain.RoutingDecision;
import com.phillippitts.hybridinference.domain.RoutingMode;
import com.phillippitts.hybridinference.domain.RoutingPolicy;
import com.phillippitts.hybridinference.event.CloudCostEvent;
import com.phillippitts.hybridinference.event.EventRouter;
import com.phillippitts.hybridinference.event.LatencyTimeoutEvent;
import com.phillippitts.hybridinference.event.RoutingEvent;
import com.phillippitts.hybridinference.exception.BudgetExceededException;
import com.phillippitts.hybridinference.exception.CloudProviderException;
import com.phillippitts.hybridinference.exception.HybridInferenceException;
import com.phillippitts.hybridinference.exception.LatencyTimeoutException;
import com.phillippitts.hybridinference.exception.LocalInferenceException;
import com.phillippitts.hybridinference.exception.NoProviderAvailableException;
import com.phillippitts.hybridinference.local.LocalInferenceService;
import com.phillippitts.hybridinference.metrics.RoutingMetrics;
import com.phillippitts.hybridinference.util.LogSanitizer;
import com.phillippitts.hybridinference.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides per request whether generation runs on-device or in the cloud.
 *
 * <p><b>Modes:</b>
 * <ul>
 *   <li>ALWAYS_LOCAL / HYBRID_MANUAL: on-device only; a handoff request is surfaced, never acted on</li>
 *   <li>ALWAYS_CLOUD: budget check, then the failover chain (or the named/default provider)</li>
 *   <li>HYBRID_AUTO: on-device first, optionally raced against {@code maxLocalLatencyMs}; a timeout,
 *       local error, handoff request or low confidence falls back to the cloud</li>
 * </ul>
 *
 * <p><b>Events:</b> every successful call publishes exactly one {@link RoutingEvent} after the result is
 * known and before it is returned. Failed calls publish none; they are counted and rethrown.
 *
 * <p><b>Thread Safety:</b> the default policy and the failover chain sit in atomic references; each
 * request captures both once, so swapping them never affects requests already in flight.
 */
@Service
public class RoutingEngine {
    private static final Logger LOG = LogManager.getLogger(RoutingEngine.class);

    /** MDC key holding the id of the request being routed. */
    public static final String MDC_REQUEST_ID = "routingRequestId";

    private final LocalInferenceService localInference;
    private final CloudProviderRegistry providerRegistry;
    private final CloudCostTracker costTracker;
    private final EventRouter eventRouter;
    private final RoutingMetrics metrics;
    private final LocalInferenceRacer racer;
    private final String defaultCloudModel;

    private final AtomicReference<RoutingPolicy> defaultPolicy;
    private final AtomicReference<ProviderFailoverChain> failoverChain;

    @Autowired
    public RoutingEngine(LocalInferenceService localInference,
                         CloudProviderRegistry providerRegistry,
                         ObjectProvider<ProviderFailoverChain> failoverChain,
                         CloudCostTracker costTracker,
                         EventRouter eventRouter,
                         RoutingMetrics metrics,
                         LocalInferenceRacer racer,
                         RoutingProperties properties) {
        this(localInference, providerRegistry, failoverChain.getIfAvailable(), costTracker, eventRouter,
                metrics, racer, properties);
    }

    /**
     * @param failoverChain chain used for cloud calls, or {@code null} to use the registry directly
     */
    public RoutingEngine(LocalInferenceService localInference,
                         CloudProviderRegistry providerRegistry,
                         ProviderFailoverChain failoverChain,
                         CloudCostTracker costTracker,
                         EventRouter eventRouter,
                         RoutingMetrics metrics,
                         LocalInferenceRacer racer,
                         RoutingProperties properties) {
        this.localInference = Objects.requireNonNull(localInference, "localInference");
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.costTracker = Objects.requireNonNull(costTracker, "costTracker");
        this.eventRouter = Objects.requireNonNull(eventRouter, "eventRouter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.racer = Objects.requireNonNull(racer, "racer");
        this.defaultCloudModel = properties.getDefaultCloudModel();
        this.defaultPolicy = new AtomicReference<>(properties.toPolicy());
        this.failoverChain = new AtomicReference<>(failoverChain);
        LOG.info("RoutingEngine initialized: defaultPolicy={}, local={}, failoverChain={}, defaultCloudModel={}",
                defaultPolicy.get(), localInference.name(),
                failoverChain == null ? "none" : failoverChain.size() + " providers", defaultCloudModel);
    }

    public RoutingPolicy getDefaultPolicy() {
        return defaultPolicy.get();
    }

    public void setDefaultPolicy(RoutingPolicy policy) {
        defaultPolicy.set(Objects.requireNonNull(policy, "policy"));
        LOG.info("Default routing policy set to {}", policy);
    }

    public ProviderFailoverChain getFailoverChain() {
        return failoverChain.get();
    }

    /**
     * @param chain new chain, or {@code null} to route cloud calls through the registry
     */
    public void setFailoverChain(ProviderFailoverChain chain) {
        failoverChain.set(chain);
        LOG.info("Failover chain {}", chain == null ? "removed" : "set (" + chain.size() + " providers)");
    }

    public RoutedGenerationResult generate(String prompt) {
        return generate(prompt, null, null, null, null);
    }

    public RoutedGenerationResult generate(String prompt, GenerationOptions options) {
        return generate(prompt, options, null, null, null);
    }

    public RoutedGenerationResult generate(String prompt, GenerationOptions options, RoutingPolicy policy) {
        return generate(prompt, options, policy, null, null);
    }

    /**
     * Routes and runs one generation request.
     *
     * @param options generation options, {@code null} for defaults
     * @param policy per-call policy, {@code null} for the engine default
     * @param cloudProviderId provider to use when no failover chain is configured, {@code null} for the default
     * @param cloudModel cloud model, {@code null} for the configured default
     * @throws BudgetExceededException if a cloud call would break the policy's cost cap
     * @throws NoProviderAvailableException if a cloud call was needed and no provider could serve it
     * @throws LocalInferenceException if an on-device-only request fails, or the caller is interrupted
     */
    public RoutedGenerationResult generate(String prompt, GenerationOptions options, RoutingPolicy policy,
                                           String cloudProviderId, String cloudModel) {
        Objects.requireNonNull(prompt, "prompt");
        RoutingPolicy effective = policy != null ? policy : defaultPolicy.get();
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();

        String previousRequestId = ThreadContext.get(MDC_REQUEST_ID);
        ThreadContext.put(MDC_REQUEST_ID, newRequestId());
        long start = System.nanoTime();
        try {
            LOG.debug("Routing request: mode={}, prompt={}", effective.mode(), LogSanitizer.preview(prompt));
            Outcome outcome = switch (effective.mode()) {
                case ALWAYS_LOCAL, HYBRID_MANUAL -> runLocal(prompt, opts, effective);
                case ALWAYS_CLOUD -> runCloud(prompt, opts, effective, cloudProviderId, cloudModel);
                case HYBRID_AUTO -> runHybridAuto(prompt, opts, effective, cloudProviderId, cloudModel);
            };
            publishDecision(outcome.routed().routingDecision(), start, outcome.costUsd());
            return outcome.routed();
        } catch (RuntimeException e) {
            metrics.incrementFailure(effective.mode(), failureKind(e));
            LOG.warn("Routing failed: mode={}, error={}", effective.mode(), e.toString());
            throw e;
        } finally {
            restoreRequestId(previousRequestId);
        }
    }

    public RoutedStreamingResult generateStream(String prompt) {
        return generateStream(prompt, null, null, null, null);
    }

    public RoutedStreamingResult generateStream(String prompt, GenerationOptions options, RoutingPolicy policy) {
        return generateStream(prompt, options, policy, null, null);
    }

    /**
     * Routes a streaming request. Only the selection is routed: ALWAYS_CLOUD streams from the cloud,
     * every other mode streams on-device. The route never changes once tokens flow.
     */
    public RoutedStreamingResult generateStream(String prompt, GenerationOptions options, RoutingPolicy policy,
                                                String cloudProviderId, String cloudModel) {
        Objects.requireNonNull(prompt, "prompt");
        RoutingPolicy effective = policy != null ? policy : defaultPolicy.get();
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();

        String previousRequestId = ThreadContext.get(MDC_REQUEST_ID);
        ThreadContext.put(MDC_REQUEST_ID, newRequestId());
        long start = System.nanoTime();
        try {
            LOG.debug("Routing stream: mode={}, prompt={}", effective.mode(), LogSanitizer.preview(prompt));
            RoutedStreamingResult routed = effective.mode() == RoutingMode.ALWAYS_CLOUD
                    ? streamFromCloud(prompt, opts, effective, cloudProviderId, cloudModel)
                    : streamFromDevice(prompt, opts, effective);
            publishDecision(routed.routingDecision(), start, null);
            return routed;
        } catch (RuntimeException e) {
            metrics.incrementFailure(effective.mode(), failureKind(e));
            LOG.warn("Stream routing failed: mode={}, error={}", effective.mode(), e.toString());
            throw e;
        } finally {
            restoreRequestId(previousRequestId);
        }
    }

    public CostSummary cloudCostSummary() {
        return costTracker.summary();
    }

    public void resetCloudCosts() {
        costTracker.reset();
        LOG.info("Cloud cost tracker reset");
    }

    private Outcome runLocal(String prompt, GenerationOptions opts, RoutingPolicy policy) {
        LlmGenerationResult result = callLocal(prompt, opts.withConfidenceThreshold(policy.confidenceThreshold()));
        if (result.handoffRequested()) {
            LOG.info("On-device model requested handoff (reason={}, confidence={}); not retried in {}",
                    result.handoffReason(), result.confidence(), policy.mode());
        }
        RoutingDecision decision = RoutingDecision.onDevice(policy, result.confidence(),
                result.handoffRequested(), result.handoffReason());
        return Outcome.onDevice(result, decision);
    }

    private Outcome runCloud(String prompt, GenerationOptions opts, RoutingPolicy policy,
                                            String cloudProviderId, String cloudModel) {
        CloudGenerationResult cloud = callCloud(prompt, opts, policy, cloudProviderId, cloudModel);
        RoutingDecision decision = RoutingDecision.cloud(policy, cloud.providerId(), cloud.model());
        return Outcome.cloud(cloud, decision);
    }

    private Outcome runHybridAuto(String prompt, GenerationOptions opts, RoutingPolicy policy,
                                                 String cloudProviderId, String cloudModel) {
        GenerationOptions localOpts = opts.withConfidenceThreshold(policy.confidenceThreshold());
        boolean bounded = policy.hasLatencyBudget();

        LlmGenerationResult local = null;
        RuntimeException localError = null;
        if (bounded) {
            LocalInferenceRacer.RaceOutcome outcome =
                    racer.race(localInference, prompt, localOpts, policy.maxLocalLatencyMs());
            if (outcome.isCompleted()) {
                local = outcome.result();
            } else if (outcome.isTimedOut()) {
                LatencyTimeoutException timeout = outcome.timeout();
                metrics.incrementLatencyTimeout();
                eventRouter.publish(LatencyTimeoutEvent.of(timeout.getMaxMs(), timeout.getActualMs(), null));
                localError = timeout;
            } else {
                localError = outcome.failure();
            }
        } else {
            try {
                local = callLocal(prompt, localOpts);
            } catch (LocalInferenceException e) {
                localError = e;
            }
        }

        if (local != null && !needsHandoff(local, policy.confidenceThreshold())) {
            RoutingDecision decision = RoutingDecision.onDevice(policy, local.confidence(), false, HandoffReason.NONE);
            return Outcome.onDevice(local, decision);
        }

        HandoffReason reason = bounded
                ? HandoffReason.FIRST_TOKEN_LOW_CONFIDENCE : HandoffReason.ROLLING_WINDOW_DEGRADATION;
        float measured = local != null && local.confidence() != null ? local.confidence() : 0.0f;
        metrics.incrementFallback(reason);
        LOG.info("Falling back to cloud: reason={}, localConfidence={}, cause={}", reason, measured,
                localError != null ? localError.toString() : "handoff requested");

        CloudGenerationResult cloud;
        try {
            cloud = callCloud(prompt, opts, policy, cloudProviderId, cloudModel);
        } catch (RuntimeException e) {
            if (localError != null) {
                e.addSuppressed(localError);
            }
            throw e;
        }
        RoutingDecision decision = RoutingDecision.hybridFallback(policy, measured, reason,
                cloud.providerId(), cloud.model());
        return Outcome.cloud(cloud, decision);
    }

    private static boolean needsHandoff(LlmGenerationResult local, float threshold) {
        return local.handoffRequested() || (local.confidence() != null && local.confidence() < threshold);
    }

    private LlmGenerationResult callLocal(String prompt, GenerationOptions opts) {
        LlmGenerationResult result;
        try {
            result = localInference.generate(prompt, opts);
        } catch (LocalInferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LocalInferenceException("Local inference failed: " + e, e);
        }
        if (result == null) {
            throw new LocalInferenceException("Local inference returned no result");
        }
        return result;
    }

    private CloudGenerationResult callCloud(String prompt, GenerationOptions opts, RoutingPolicy policy,
                                            String cloudProviderId, String cloudModel) {
        CloudGenerationOptions cloudOptions = CloudGenerationOptions.from(opts, cloudModel, defaultCloudModel);
        ProviderFailoverChain chain = activeChain();
        CloudGenerationResult result;
        if (chain != null) {
            enforceBudget(policy, chain.estimateCostUsd(prompt, cloudOptions));
            result = chain.generate(prompt, cloudOptions);
        } else {
            CloudProvider provider = resolveProvider(cloudProviderId);
            enforceBudget(policy, provider.estimateCostUsd(prompt, cloudOptions));
            result = callProvider(provider, prompt, cloudOptions);
        }
        recordCost(result);
        return result;
    }

    private static CloudGenerationResult callProvider(CloudProvider provider, String prompt,
                                                      CloudGenerationOptions options) {
        try {
            return provider.generate(prompt, options);
        } catch (HybridInferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CloudProviderException(provider.providerId(), "Cloud generation failed: " + e, e);
        }
    }

    private RoutedStreamingResult streamFromDevice(String prompt, GenerationOptions opts, RoutingPolicy policy) {
        Flux<String> stream;
        try {
            stream = localInference.generateStream(prompt, opts.withConfidenceThreshold(policy.confidenceThreshold()));
        } catch (LocalInferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LocalInferenceException("Local streaming failed: " + e, e);
        }
        return new RoutedStreamingResult(stream, RoutingDecision.onDevice(policy, null, false, HandoffReason.NONE));
    }

    private RoutedStreamingResult streamFromCloud(String prompt, GenerationOptions opts, RoutingPolicy policy,
                                                  String cloudProviderId, String cloudModel) {
        CloudGenerationOptions cloudOptions = CloudGenerationOptions.from(opts, cloudModel, defaultCloudModel);
        ProviderFailoverChain chain = activeChain();
        if (chain != null) {
            enforceBudget(policy, chain.estimateCostUsd(prompt, cloudOptions));
            ProviderStream selected = chain.openStream(prompt, cloudOptions);
            return new RoutedStreamingResult(selected.stream(),
                    RoutingDecision.cloud(policy, selected.providerId(), cloudOptions.model()));
        }
        CloudProvider provider = resolveProvider(cloudProviderId);
        enforceBudget(policy, provider.estimateCostUsd(prompt, cloudOptions));
        return new RoutedStreamingResult(provider.generateStream(prompt, cloudOptions),
                RoutingDecision.cloud(policy, provider.providerId(), cloudOptions.model()));
    }

    private ProviderFailoverChain activeChain() {
        ProviderFailoverChain chain = failoverChain.get();
        return chain != null && !chain.isEmpty() ? chain : null;
    }

    private CloudProvider resolveProvider(String cloudProviderId) {
        return cloudProviderId != null ? providerRegistry.get(cloudProviderId) : providerRegistry.getDefault();
    }

    /**
     * Rejects the call when a cost cap is set and either the cap is already reached or the estimated
     * cost of this call would cross it. Runs before any provider call.
     */
    private void enforceBudget(RoutingPolicy policy, double estimatedCostUsd) {
        if (!policy.hasCostCap()) {
            return;
        }
        double current = costTracker.summary().totalCostUsd();
        if (current >= policy.costCapUsd() || costTracker.wouldExceedBudget(estimatedCostUsd, policy.costCapUsd())) {
            LOG.warn("Cloud budget exceeded: current=${}, estimate=${}, cap=${}",
                    current, estimatedCostUsd, policy.costCapUsd());
            throw new BudgetExceededException(current, policy.costCapUsd());
        }
    }

    private void recordCost(CloudGenerationResult result) {
        Double cost = result.estimatedCostUsd();
        if (cost == null) {
            return;
        }
        if (cost < 0 || cost.isNaN()) {
            LOG.warn("Ignoring invalid cost {} reported by {}", cost, result.providerId());
            return;
        }
        costTracker.recordRequest(result.providerId(), result.inputTokens(), result.outputTokens(), cost);
        metrics.recordCloudCost(result.providerId(), cost);
        double cumulative = costTracker.summary().totalCostUsd();
        eventRouter.publish(CloudCostEvent.of(result.providerId(), result.inputTokens(), result.outputTokens(),
                cost, cumulative, null));
    }

    private void publishDecision(RoutingDecision decision, long startNanos, Double estimatedCostUsd) {
        double latencyMs = TimeUtils.elapsedMillisPrecise(startNanos);
        metrics.recordDecision(decision.policy().mode(), decision.executionTarget(),
                (long) (latencyMs * TimeUtils.NANOS_PER_MILLI));
        eventRouter.publish(RoutingEvent.of(decision, latencyMs, estimatedCostUsd, null));
        LOG.debug("Routed: mode={}, target={}, provider={}, latencyMs={}", decision.policy().mode(),
                decision.executionTarget(), decision.cloudProviderId(), String.format(Locale.ROOT, "%.1f", latencyMs));
    }

    /** Routed result plus the cloud cost it incurred, if any. */
    private record Outcome(RoutedGenerationResult routed, Double costUsd) {

        static Outcome onDevice(LlmGenerationResult result, RoutingDecision decision) {
            return new Outcome(new RoutedGenerationResult(result, decision), null);
        }

        static Outcome cloud(CloudGenerationResult cloud, RoutingDecision decision) {
            return new Outcome(new RoutedGenerationResult(LlmGenerationResult.fromCloud(cloud), decision),
                    cloud.estimatedCostUsd());
        }
    }

    private static String failureKind(RuntimeException e) {
        if (e instanceof BudgetExceededException) {
            return "budget";
        }
        if (e instanceof NoProviderAvailableException) {
            return "no_provider";
        }
        if (e instanceof LocalInferenceException) {
            return "local";
        }
        if (e instanceof CloudProviderException) {
            return "provider";
        }
        return "error";
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static void restoreRequestId(String previous) {
        if (previous == null) {
            ThreadContext.remove(MDC_REQUEST_ID);
        } else {
            ThreadContext.put(MDC_REQUEST_ID, previous);
        }
    }
}
