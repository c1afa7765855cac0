package com.phillippitts.hybridinference.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published by the failover chain when a cloud backend fails and the chain moves past it.
 *
 * @param nextProviderId provider the chain tries next, or {@code null} if none is left
 * @param errorType simple class name of the failure (no payload text)
 */
public record ProviderFailoverEvent(String id,
                                    Instant timestamp,
                                    String sessionId,
                                    EventDestination destination,
                                    String failedProviderId,
                                    String nextProviderId,
                                    String errorType,
                                    int consecutiveFailures,
                                    boolean circuitOpen) implements SdkEvent {

    public static final String TYPE = "cloud.provider_failover";

    public ProviderFailoverEvent {
        id = id == null ? EventIds.next() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        destination = destination == null ? EventDestination.ALL : destination;
    }

    public static ProviderFailoverEvent of(String failedProviderId, String nextProviderId, Throwable error,
                                           int consecutiveFailures, boolean circuitOpen) {
        return new ProviderFailoverEvent(null, null, null, EventDestination.ALL, failedProviderId,
                nextProviderId, error == null ? "unknown" : error.getClass().getSimpleName(),
                consecutiveFailures, circuitOpen);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public EventCategory category() {
        return EventCategory.NETWORK;
    }

    @Override
    public Map<String, String> properties() {
        return new EventProperties()
                .put("failed_provider_id", failedProviderId)
                .put("next_provider_id", nextProviderId)
                .put("error_type", errorType)
                .put("consecutive_failures", consecutiveFailures)
                .put("circuit_open", circuitOpen)
                .build();
    }
}
