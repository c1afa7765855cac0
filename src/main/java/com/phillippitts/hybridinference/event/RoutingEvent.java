package com.phillippitts.hybridinference.event;

import com.phillippitts.hybridinference.domain.ExecutionTarget;
import com.phillippitts.hybridinference.domain.HandoffReason;
import com.phillippitts.hybridinference.domain.RoutingDecision;
import com.phillippitts.hybridinference.domain.RoutingMode;

import java.time.Instant;
import java.util.Map;

/**
 * Published exactly once per routed request, after the result is known and before it is returned.
 */
public record RoutingEvent(String id,
                           Instant timestamp,
                           String sessionId,
                           EventDestination destination,
                           RoutingMode routingMode,
                           ExecutionTarget executionTarget,
                           float confidence,
                           boolean cloudHandoffTriggered,
                           HandoffReason handoffReason,
                           String cloudProviderId,
                           String cloudModel,
                           double latencyMs,
                           Double estimatedCostUsd) implements SdkEvent {

    public static final String TYPE = "routing.decision";

    public RoutingEvent {
        id = id == null ? EventIds.next() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        destination = destination == null ? EventDestination.ALL : destination;
        handoffReason = handoffReason == null ? HandoffReason.NONE : handoffReason;
    }

    public static RoutingEvent of(RoutingDecision decision, double latencyMs, Double estimatedCostUsd,
                                  String sessionId) {
        return new RoutingEvent(null, null, sessionId, EventDestination.ALL,
                decision.policy().mode(), decision.executionTarget(), decision.onDeviceConfidence(),
                decision.cloudHandoffTriggered(), decision.handoffReason(),
                decision.cloudProviderId(), decision.cloudModel(), latencyMs, estimatedCostUsd);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public EventCategory category() {
        return EventCategory.LLM;
    }

    @Override
    public Map<String, String> properties() {
        return new EventProperties()
                .putEnum("routing_mode", routingMode)
                .putEnum("execution_target", executionTarget)
                .put("confidence", confidence)
                .put("cloud_handoff_triggered", cloudHandoffTriggered)
                .putEnum("handoff_reason", handoffReason)
                .put("cloud_provider_id", cloudProviderId)
                .put("cloud_model", cloudModel)
                .putMillis("latency_ms", latencyMs)
                .putUsd("estimated_cost_usd", estimatedCostUsd)
                .build();
    }
}
