package com.phillippitts.hybridinference.event;

import java.time.Instant;
import java.util.Map;

/** Published after a cloud call's cost has been recorded by the cost tracker. */
public record CloudCostEvent(String id,
                             Instant timestamp,
                             String sessionId,
                             EventDestination destination,
                             String providerId,
                             int inputTokens,
                             int outputTokens,
                             double costUsd,
                             double cumulativeTotalUsd) implements SdkEvent {

    public static final String TYPE = "cloud.cost";

    public CloudCostEvent {
        id = id == null ? EventIds.next() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        destination = destination == null ? EventDestination.ALL : destination;
    }

    public static CloudCostEvent of(String providerId, int inputTokens, int outputTokens,
                                    double costUsd, double cumulativeTotalUsd, String sessionId) {
        return new CloudCostEvent(null, null, sessionId, EventDestination.ALL, providerId,
                inputTokens, outputTokens, costUsd, cumulativeTotalUsd);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public EventCategory category() {
        return EventCategory.PERFORMANCE;
    }

    @Override
    public Map<String, String> properties() {
        return new EventProperties()
                .put("provider_id", providerId)
                .put("input_tokens", inputTokens)
                .put("output_tokens", outputTokens)
                .putUsd("cost_usd", costUsd)
                .putUsd("cumulative_total_usd", cumulativeTotalUsd)
                .build();
    }
}
