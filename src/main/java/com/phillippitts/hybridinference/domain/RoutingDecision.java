package com.phillippitts.hybridinference.domain;

import java.util.Objects;

/**
 * Records how a single request was routed. Produced exactly once per request.
 *
 * <p>{@code cloudProviderId} and {@code cloudModel} are non-null iff a cloud backend served the
 * request ({@link ExecutionTarget#CLOUD} or {@link ExecutionTarget#HYBRID_FALLBACK}).
 */
public record RoutingDecision(ExecutionTarget executionTarget,
                              RoutingPolicy policy,
                              float onDeviceConfidence,
                              boolean cloudHandoffTriggered,
                              HandoffReason handoffReason,
                              String cloudProviderId,
                              String cloudModel) {

    public RoutingDecision {
        Objects.requireNonNull(executionTarget, "executionTarget");
        Objects.requireNonNull(policy, "policy");
        handoffReason = handoffReason == null ? HandoffReason.NONE : handoffReason;
    }

    /**
     * Decision for a request served on-device.
     *
     * @param confidence self-reported confidence, or {@code null} when the capability did not measure it
     */
    public static RoutingDecision onDevice(RoutingPolicy policy, Float confidence,
                                           boolean handoffRequested, HandoffReason reason) {
        return new RoutingDecision(ExecutionTarget.ON_DEVICE, policy,
                confidence == null ? 1.0f : confidence, handoffRequested, reason, null, null);
    }

    public static RoutingDecision cloud(RoutingPolicy policy, String providerId, String model) {
        return new RoutingDecision(ExecutionTarget.CLOUD, policy, 1.0f, false, HandoffReason.NONE,
                Objects.requireNonNull(providerId, "providerId"), Objects.requireNonNull(model, "model"));
    }

    public static RoutingDecision hybridFallback(RoutingPolicy policy, float onDeviceConfidence,
                                                 HandoffReason reason, String providerId, String model) {
        return new RoutingDecision(ExecutionTarget.HYBRID_FALLBACK, policy, onDeviceConfidence, true, reason,
                Objects.requireNonNull(providerId, "providerId"), Objects.requireNonNull(model, "model"));
    }

    public boolean usedCloud() {
        return executionTarget != ExecutionTarget.ON_DEVICE;
    }
}
