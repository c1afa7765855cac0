package com.phillippitts.hybridinference.domain;

import java.util.Objects;

/**
 * Immutable routing policy captured per request.
 *
 * <p>A request keeps the policy value it started with; replacing the engine's default policy
 * only affects requests that begin afterwards.
 *
 * @param mode routing mode
 * @param confidenceThreshold minimum on-device confidence (0.0 - 1.0) before a handoff is requested
 * @param maxLocalLatencyMs latency budget for on-device generation, 0 = unbounded
 * @param costCapUsd cumulative cloud spend cap in USD, 0 = unbounded
 */
public record RoutingPolicy(RoutingMode mode,
                            float confidenceThreshold,
                            long maxLocalLatencyMs,
                            double costCapUsd) {

    public static final float DEFAULT_CONFIDENCE_THRESHOLD = 0.7f;

    public RoutingPolicy {
        Objects.requireNonNull(mode, "mode");
        if (Float.isNaN(confidenceThreshold) || confidenceThreshold < 0.0f || confidenceThreshold > 1.0f) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0.0, 1.0]: " + confidenceThreshold);
        }
        if (maxLocalLatencyMs < 0) {
            throw new IllegalArgumentException("maxLocalLatencyMs must be >= 0: " + maxLocalLatencyMs);
        }
        if (Double.isNaN(costCapUsd) || costCapUsd < 0.0) {
            throw new IllegalArgumentException("costCapUsd must be >= 0: " + costCapUsd);
        }
    }

    /** Hybrid-manual with the default threshold, no latency budget and no cost cap. */
    public static RoutingPolicy defaults() {
        return new RoutingPolicy(RoutingMode.HYBRID_MANUAL, DEFAULT_CONFIDENCE_THRESHOLD, 0, 0.0);
    }

    public static RoutingPolicy alwaysLocal() {
        return new RoutingPolicy(RoutingMode.ALWAYS_LOCAL, DEFAULT_CONFIDENCE_THRESHOLD, 0, 0.0);
    }

    public static RoutingPolicy alwaysCloud() {
        return new RoutingPolicy(RoutingMode.ALWAYS_CLOUD, DEFAULT_CONFIDENCE_THRESHOLD, 0, 0.0);
    }

    public static RoutingPolicy hybridAuto(float confidenceThreshold) {
        return new RoutingPolicy(RoutingMode.HYBRID_AUTO, confidenceThreshold, 0, 0.0);
    }

    public RoutingPolicy withMode(RoutingMode newMode) {
        return new RoutingPolicy(newMode, confidenceThreshold, maxLocalLatencyMs, costCapUsd);
    }

    public RoutingPolicy withMaxLocalLatencyMs(long newMaxLocalLatencyMs) {
        return new RoutingPolicy(mode, confidenceThreshold, newMaxLocalLatencyMs, costCapUsd);
    }

    public RoutingPolicy withCostCapUsd(double newCostCapUsd) {
        return new RoutingPolicy(mode, confidenceThreshold, maxLocalLatencyMs, newCostCapUsd);
    }

    public boolean hasLatencyBudget() {
        return maxLocalLatencyMs > 0;
    }

    public boolean hasCostCap() {
        return costCapUsd > 0.0;
    }
}
