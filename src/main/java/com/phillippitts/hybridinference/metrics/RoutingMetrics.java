package com.phillippitts.hybridinference.metrics;

import com.phillippitts.hybridinference.domain.ExecutionTarget;
import com.phillippitts.hybridinference.domain.HandoffReason;
import com.phillippitts.hybridinference.domain.RoutingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for routing decisions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end routing latency per execution target</li>
 *   <li>Decision counts per mode and target</li>
 *   <li>Cloud fallbacks per handoff reason, latency timeouts</li>
 *   <li>Provider failures, cloud spend and failed requests</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RoutingMetrics {

    static final String METRIC_PREFIX = "hybridinference.routing";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a completed routing decision and its end-to-end latency.
     *
     * @param mode routing mode of the request policy
     * @param target where the request was served
     * @param durationNanos duration in nanoseconds
     */
    public void recordDecision(RoutingMode mode, ExecutionTarget target, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to route and serve a generation request")
                .tag("target", tagValue(target))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".decisions")
                .description("Number of routing decisions by mode and target")
                .tag("mode", tagValue(mode))
                .tag("target", tagValue(target))
                .register(registry)
                .increment();
    }

    /**
     * Increments the fallback counter.
     *
     * @param reason why the on-device result was handed off to the cloud
     */
    public void incrementFallback(HandoffReason reason) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of hybrid requests handed off to the cloud")
                .tag("reason", tagValue(reason))
                .register(registry)
                .increment();
    }

    public void incrementLatencyTimeout() {
        Counter.builder(METRIC_PREFIX + ".latency.timeout")
                .description("Number of on-device generations that exceeded the latency budget")
                .register(registry)
                .increment();
    }

    /**
     * Increments the provider failure counter.
     *
     * @param providerId provider that failed
     * @param circuitOpen whether the failure left the circuit open
     */
    public void incrementProviderFailure(String providerId, boolean circuitOpen) {
        Counter.builder(METRIC_PREFIX + ".provider.failure")
                .description("Number of failed cloud provider attempts")
                .tag("provider", providerId)
                .tag("circuit", circuitOpen ? "open" : "closed")
                .register(registry)
                .increment();
    }

    /**
     * Adds recorded cloud spend.
     *
     * @param providerId provider the spend is attributed to
     * @param costUsd cost in USD
     */
    public void recordCloudCost(String providerId, double costUsd) {
        Counter.builder(METRIC_PREFIX + ".cloud.cost")
                .description("Cloud spend recorded by the cost tracker")
                .baseUnit("usd")
                .tag("provider", providerId)
                .register(registry)
                .increment(costUsd);
    }

    /**
     * Increments the request failure counter.
     *
     * @param mode routing mode of the failed request
     * @param reason failure kind (budget, no_provider, local, provider, error)
     */
    public void incrementFailure(RoutingMode mode, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of routed requests that failed")
                .tag("mode", tagValue(mode))
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
